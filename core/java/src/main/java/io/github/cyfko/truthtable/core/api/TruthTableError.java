package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;
import io.github.cyfko.truthtable.core.exception.MismatchedBracketException;
import io.github.cyfko.truthtable.core.exception.TruthTableException;

import java.util.Objects;

/**
 * Describes why an expression was rejected.
 *
 * @param kind    the error category
 * @param message a human-readable explanation
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TruthTableError(ErrorKind kind, String message) {

    public TruthTableError {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }

    public static TruthTableError mismatchedBracket(String message) {
        return new TruthTableError(ErrorKind.MISMATCHED_BRACKET, message);
    }

    public static TruthTableError expressionSyntax(String message) {
        return new TruthTableError(ErrorKind.EXPRESSION_SYNTAX, message);
    }

    /**
     * Converts this error into the matching unchecked exception.
     *
     * @return a {@link MismatchedBracketException} or an {@link ExpressionSyntaxException}
     */
    public TruthTableException toException() {
        return switch (kind) {
            case MISMATCHED_BRACKET -> new MismatchedBracketException(message);
            case EXPRESSION_SYNTAX -> new ExpressionSyntaxException(message);
        };
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}

package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.ErrorKind;

/**
 * Thrown when an expression that cannot be evaluated is unwrapped.
 * <p>
 * Typical causes are an operator without enough operands ({@code ".A"}, {@code "A.."})
 * or operands left over without an operator ({@code "A B"}).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ExpressionSyntaxException extends TruthTableException {

    public static final String DEFAULT_MESSAGE = "Invalid Boolean Algebra expression syntax";

    public ExpressionSyntaxException() {
        this(DEFAULT_MESSAGE);
    }

    public ExpressionSyntaxException(String message) {
        super(ErrorKind.EXPRESSION_SYNTAX, message);
    }

    public ExpressionSyntaxException(String message, Throwable cause) {
        super(ErrorKind.EXPRESSION_SYNTAX, message, cause);
    }
}

package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.ErrorKind;

/**
 * Thrown when an expression with unbalanced brackets is unwrapped.
 *
 * <pre>{@code
 * engine.computeTruthTable("(A.B").orElseThrow();
 * // -> "Mismatched brackets: unmatched '('"
 *
 * engine.computeTruthTable("A.)").orElseThrow();
 * // -> "Mismatched brackets: unmatched ')'"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class MismatchedBracketException extends TruthTableException {

    public static final String DEFAULT_MESSAGE = "No matching bracket found.";

    public MismatchedBracketException() {
        this(DEFAULT_MESSAGE);
    }

    public MismatchedBracketException(String message) {
        super(ErrorKind.MISMATCHED_BRACKET, message);
    }

    public MismatchedBracketException(String message, Throwable cause) {
        super(ErrorKind.MISMATCHED_BRACKET, message, cause);
    }
}

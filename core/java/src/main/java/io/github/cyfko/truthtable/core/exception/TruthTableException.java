package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.api.ErrorKind;
import io.github.cyfko.truthtable.core.api.Result;

/**
 * Base class of the exceptions raised when a rejected expression is unwrapped.
 * <p>
 * The pipeline itself never throws for a malformed expression; it returns a failed
 * {@link Result}. These exceptions surface only through {@link Result#orElseThrow()},
 * for callers that prefer exception handling.
 * </p>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     TruthTable table = engine.computeTruthTable(userExpression).orElseThrow();
 * } catch (MismatchedBracketException e) {
 *     // highlight brackets
 * } catch (TruthTableException e) {
 *     logger.fine(() -> "Rejected " + userExpression + ": " + e.getKind());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see MismatchedBracketException
 * @see ExpressionSyntaxException
 */
public abstract class TruthTableException extends RuntimeException {

    private final ErrorKind kind;

    protected TruthTableException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TruthTableException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Category of the rejection.
     *
     * @return the error kind
     */
    public ErrorKind getKind() {
        return kind;
    }
}

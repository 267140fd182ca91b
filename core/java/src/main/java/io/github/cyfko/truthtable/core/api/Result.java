package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.exception.TruthTableException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a pipeline stage: either a value or a {@link TruthTableError}.
 * <p>
 * The pipeline reports rejected expressions through this type rather than by throwing.
 * Instances are immutable and created via {@link #success(Object)} and
 * {@link #failure(TruthTableError)}.
 * </p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * Result<TruthTable> result = engine.computeTruthTable("(A.B");
 * if (!result.isSuccess()) {
 *     System.out.println("Rejected: " + result.getError().message());
 * }
 *
 * // Or, when an exception suits the caller better:
 * TruthTable table = engine.computeTruthTable("A.B").orElseThrow();
 * }</pre>
 *
 * @param <T> the type of the success value
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Result<T> {

    private final T value;
    private final TruthTableError error;

    private Result(T value, TruthTableError error) {
        this.value = value;
        this.error = error;
    }

    /**
     * Creates a successful result.
     *
     * @param value the value, not null
     * @param <T>   the value type
     * @return a success holding {@code value}
     */
    public static <T> Result<T> success(T value) {
        return new Result<>(Objects.requireNonNull(value, "value cannot be null"), null);
    }

    /**
     * Creates a failed result.
     *
     * @param error the reason, not null
     * @param <T>   the value type the stage would have produced
     * @return a failure holding {@code error}
     */
    public static <T> Result<T> failure(TruthTableError error) {
        return new Result<>(null, Objects.requireNonNull(error, "error cannot be null"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * Returns the success value.
     *
     * @return the value
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value present: " + error);
        }
        return value;
    }

    /**
     * Returns the failure reason.
     *
     * @return the error
     * @throws IllegalStateException if this result is a success
     */
    public TruthTableError getError() {
        if (error == null) {
            throw new IllegalStateException("No error present");
        }
        return error;
    }

    /**
     * Transforms the success value; a failure passes through unchanged.
     */
    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper);
        return error == null ? success(mapper.apply(value)) : failure(error);
    }

    /**
     * Chains a further stage; a failure short-circuits it.
     */
    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        Objects.requireNonNull(mapper);
        if (error != null) {
            return failure(error);
        }
        return Objects.requireNonNull(mapper.apply(value), "mapper returned null");
    }

    /**
     * Returns the value, or throws the exception matching the error kind.
     *
     * @return the value
     * @throws TruthTableException if this result is a failure
     */
    public T orElseThrow() {
        if (error != null) {
            throw error.toException();
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Result)) return false;
        Result<?> other = (Result<?>) o;
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "Result[success=" + value + "]" : "Result[failure=" + error + "]";
    }
}

package ledger;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of an operation that can fail for an expected reason.
 *
 * <p>Expected failures (missing aggregate, ownership mismatch, rule violation, storage
 * failure) are returned as {@link Err} instead of being thrown. Callers inspect the
 * variant with {@code instanceof}:
 *
 * <pre>{@code
 * Result<String> result = commandBus.dispatch(command);
 * if (result instanceof Result.Err<String> err) {
 *     log(err.kind(), err.message());
 * }
 * }</pre>
 *
 * @param <T> the success value type
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(ErrorKind kind, String message) {
        return new Err<>(kind, message);
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * Maps the success value, leaving an error untouched.
     */
    default <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        return ((Err<T>) this).retype();
    }

    default <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (this instanceof Ok<T> ok) {
            return Objects.requireNonNull(mapper.apply(ok.value()), "mapper result");
        }
        return ((Err<T>) this).retype();
    }

    /**
     * Returns the success value.
     *
     * @throws IllegalStateException if this is an error
     */
    default T orElseThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        Err<T> err = (Err<T>) this;
        throw new IllegalStateException(err.kind() + ": " + err.message());
    }

    /**
     * Successful outcome. The value may be {@code null} for operations with nothing to return.
     */
    record Ok<T>(T value) implements Result<T> {
    }

    /**
     * Failed outcome with a classification and a human-readable message.
     */
    record Err<T>(ErrorKind kind, String message) implements Result<T> {
        public Err {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
        }

        /**
         * Re-types this error for propagation through a caller with a different value type.
         */
        public <U> Err<U> retype() {
            return new Err<>(kind, message);
        }
    }
}

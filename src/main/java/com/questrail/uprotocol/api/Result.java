package com.questrail.uprotocol.api;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result
 * =============================================================================
 * Either a success value or the {@link UStatus} explaining why there is none.
 *
 * <p>Operational failures travel through this type instead of exceptions.
 * Asking an {@link Err} for its value is a programming error and throws
 * {@link IllegalStateException}.</p>
 *
 * @param <V> success value type
 */
public sealed interface Result<V> permits Result.Ok, Result.Err
{
    static <V> Result<V> ok(V value) {
        return new Ok<>(value);
    }

    static <V> Result<V> err(UStatus status) {
        return new Err<>(status);
    }

    boolean isOk();

    /**
     * @throws IllegalStateException if this result is an error
     */
    V value();

    /**
     * Returns the status of this result; {@link UStatus#ok()} for a success.
     */
    UStatus status();

    default Optional<V> toOptional() {
        return isOk() ? Optional.of(value()) : Optional.empty();
    }

    default <U> Result<U> map(Function<? super V, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (isOk()) {
            return new Ok<>(mapper.apply(value()));
        }
        return new Err<>(status());
    }

    record Ok<V>(V value) implements Result<V> {
        public Ok {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public UStatus status() {
            return UStatus.ok();
        }
    }

    record Err<V>(UStatus status) implements Result<V> {
        public Err {
            Objects.requireNonNull(status, "status");
            if (status.isOk()) {
                throw new IllegalArgumentException("Err requires a non-OK status");
            }
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public V value() {
            throw new IllegalStateException("No value present: " + status);
        }
    }
}

package io.rpcmeta.core.engine;

import io.rpcmeta.core.error.MetadataException;
import java.util.Objects;

/**
 * Value-or-error outcome of {@link MetadataDeriver#tryDerive}.
 *
 * @param status  outcome
 * @param value   the derived value, {@code null} on failure
 * @param failure the exception, {@code null} on success
 * @param <T>     the schema type
 */
public record DerivationResult<T>(Status status, T value, MetadataException failure) {

    public enum Status {
        SUCCESS,
        FAILURE
    }

    public DerivationResult {
        Objects.requireNonNull(status, "status must not be null");
        if (status == Status.SUCCESS && value == null) {
            throw new IllegalArgumentException("a successful result needs a value");
        }
        if (status == Status.FAILURE && failure == null) {
            throw new IllegalArgumentException("a failed result needs a failure");
        }
    }

    public static <T> DerivationResult<T> success(T value) {
        return new DerivationResult<>(Status.SUCCESS, value, null);
    }

    public static <T> DerivationResult<T> failure(MetadataException failure) {
        return new DerivationResult<>(Status.FAILURE, null, failure);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}

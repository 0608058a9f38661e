package de.conciso.torrentbridge.api;

import java.util.function.Function;

/**
 * Outcome of a remote call: either a value or an {@link ApiError}, never both.
 *
 * <p>Clients return this instead of throwing, so callers decide between retry and
 * terminal failure themselves.
 */
public record ApiResult<T>(T value, ApiError error) {

    public static <T> ApiResult<T> ok(T value) {
        return new ApiResult<>(value, null);
    }

    public static <T> ApiResult<T> failure(ApiError error) {
        return new ApiResult<>(null, error);
    }

    public static <T> ApiResult<T> failure(ApiError.Kind kind, String message) {
        return new ApiResult<>(null, ApiError.of(kind, message));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean hasError(ApiError.Kind kind) {
        return error != null && error.kind() == kind;
    }

    public <R> ApiResult<R> map(Function<T, R> mapper) {
        return isOk() ? ok(mapper.apply(value)) : failure(error);
    }

    /** Re-types a failed result. Must only be called when {@link #isOk()} is false. */
    public <R> ApiResult<R> propagate() {
        if (isOk()) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return failure(error);
    }
}

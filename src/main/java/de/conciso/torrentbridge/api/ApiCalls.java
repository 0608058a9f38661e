package de.conciso.torrentbridge.api;

import java.time.Duration;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Runs {@code RestClient} calls and turns whatever they throw into an {@link ApiResult}.
 */
public final class ApiCalls {

    private static final Logger log = LoggerFactory.getLogger(ApiCalls.class);

    private ApiCalls() {
    }

    public static <T> ApiResult<T> execute(String operation, Supplier<T> call) {
        try {
            return ApiResult.ok(call.get());
        } catch (RestClientException | IllegalArgumentException e) {
            ApiError error = classify(operation, e);
            log.debug("{} failed: {}", operation, error);
            return ApiResult.failure(error);
        }
    }

    /**
     * Like {@link #execute} but repeats retryable failures up to {@code retries} more times,
     * waiting {@code backoff * attempt} between attempts. Only for idempotent calls.
     */
    public static <T> ApiResult<T> executeWithRetry(String operation, int retries, Duration backoff, Supplier<T> call) {
        ApiResult<T> result = execute(operation, call);
        for (int attempt = 1; attempt <= retries && !result.isOk() && result.error().isRetryable(); attempt++) {
            log.warn("{} failed ({}), retry {}/{}", operation, result.error().kind(), attempt, retries);
            if (!sleep(backoff.multipliedBy(attempt))) {
                return ApiResult.failure(ApiError.Kind.CANCELLED, operation + " interrupted");
            }
            result = execute(operation, call);
        }
        return result;
    }

    public static ApiError classify(String operation, Exception e) {
        if (e instanceof RestClientResponseException response) {
            return classifyStatus(operation, response.getStatusCode().value());
        }
        if (e instanceof ResourceAccessException) {
            return ApiError.of(ApiError.Kind.TRANSIENT, operation + " failed: " + e.getMessage());
        }
        return ApiError.of(ApiError.Kind.PERMANENT, operation + " failed: " + e.getMessage());
    }

    public static ApiError classifyStatus(String operation, int status) {
        String message = operation + " failed: HTTP " + status;
        if (status == 401 || status == 403) {
            return ApiError.of(ApiError.Kind.UNAUTHENTICATED, message);
        }
        if (status == 404) {
            return ApiError.of(ApiError.Kind.NOT_FOUND, message);
        }
        if (status == 429) {
            return ApiError.of(ApiError.Kind.RATE_LIMITED, message);
        }
        if (status >= 500) {
            return ApiError.of(ApiError.Kind.TRANSIENT, message);
        }
        return ApiError.of(ApiError.Kind.PERMANENT, message);
    }

    private static boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

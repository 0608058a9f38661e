package de.conciso.torrentbridge.api;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import static org.assertj.core.api.Assertions.assertThat;

class ApiCallsTest {

    @Test
    void classifiesStatusCodes() {
        assertThat(ApiCalls.classifyStatus("op", 401).kind()).isEqualTo(ApiError.Kind.UNAUTHENTICATED);
        assertThat(ApiCalls.classifyStatus("op", 403).kind()).isEqualTo(ApiError.Kind.UNAUTHENTICATED);
        assertThat(ApiCalls.classifyStatus("op", 404).kind()).isEqualTo(ApiError.Kind.NOT_FOUND);
        assertThat(ApiCalls.classifyStatus("op", 429).kind()).isEqualTo(ApiError.Kind.RATE_LIMITED);
        assertThat(ApiCalls.classifyStatus("op", 502).kind()).isEqualTo(ApiError.Kind.TRANSIENT);
        assertThat(ApiCalls.classifyStatus("op", 422).kind()).isEqualTo(ApiError.Kind.PERMANENT);
    }

    @Test
    void networkFailureIsTransient() {
        ApiResult<String> result = ApiCalls.execute("List", () -> {
            throw new ResourceAccessException("connection refused");
        });

        assertThat(result.hasError(ApiError.Kind.TRANSIENT)).isTrue();
        assertThat(result.error().message()).contains("List failed");
    }

    @Test
    void retriesTransientFailuresUpToTheBound() {
        var calls = new AtomicInteger();

        ApiResult<String> result = ApiCalls.executeWithRetry("List", 2, Duration.ZERO, () -> {
            calls.incrementAndGet();
            throw new HttpServerErrorException(HttpStatus.SERVICE_UNAVAILABLE);
        });

        assertThat(calls).hasValue(3);
        assertThat(result.hasError(ApiError.Kind.TRANSIENT)).isTrue();
    }

    @Test
    void doesNotRetryPermanentFailures() {
        var calls = new AtomicInteger();

        ApiResult<String> result = ApiCalls.executeWithRetry("List", 2, Duration.ZERO, () -> {
            calls.incrementAndGet();
            throw new HttpClientErrorException(HttpStatus.BAD_REQUEST);
        });

        assertThat(calls).hasValue(1);
        assertThat(result.hasError(ApiError.Kind.PERMANENT)).isTrue();
    }

    @Test
    void succeedsAfterOneTransientFailure() {
        var calls = new AtomicInteger();

        ApiResult<String> result = ApiCalls.executeWithRetry("List", 2, Duration.ZERO, () -> {
            if (calls.incrementAndGet() == 1) {
                throw new ResourceAccessException("timeout");
            }
            return "ok";
        });

        assertThat(result.isOk()).isTrue();
        assertThat(result.value()).isEqualTo("ok");
    }
}

package com.example.narrator.engine;

import com.example.narrator.config.OpenAIServiceProperties;
import com.example.narrator.exception.ExternalServiceException;
import com.example.narrator.exception.NarratorException;
import com.example.narrator.exception.TransientServiceException;
import com.example.narrator.util.TextUtil;
import org.slf4j.Logger;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Bounded exponential backoff shared by the HTTP adapters. Only transient failures are retried:
 * timeouts, dropped connections, 429 and 5xx.
 */
final class RetrySupport {

    private RetrySupport() {
    }

    static Retry transientBackoff(String service, String label, OpenAIServiceProperties props, Logger logger) {
        int maxAttempts = Math.max(1, props.getMaxAttempts());
        Duration backoff = Duration.ofMillis(Math.max(1L, props.getBackoffMillis()));
        return Retry.backoff(maxAttempts - 1L, backoff)
                .filter(RetrySupport::isRetryable)
                .doBeforeRetry(signal -> {
                    Throwable failure = signal.failure();
                    Throwable root = rootCause(failure);
                    logger.warn("{} retry attempt={} label={} type={} rootCause={} message={}",
                            service,
                            signal.totalRetriesInARow() + 1,
                            label,
                            failure == null ? "unknown" : failure.getClass().getSimpleName(),
                            root == null ? "unknown" : root.getClass().getSimpleName(),
                            root == null ? "" : root.getMessage());
                })
                .onRetryExhaustedThrow((spec, signal) -> new TransientServiceException(service,
                        service + " failed after " + maxAttempts + " attempts label=" + label + ": "
                                + messageOf(signal.failure()),
                        signal.failure()));
    }

    static NarratorException statusError(String service, HttpStatusCode status, String body) {
        String message = "%s error %s: %s".formatted(service, status, TextUtil.truncate(body, 500));
        if (status.value() == 429 || status.is5xxServerError()) {
            return new TransientServiceException(service, message);
        }
        return new ExternalServiceException(service, status.value(), message);
    }

    static boolean isRetryable(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (cursor instanceof TransientServiceException
                    || cursor instanceof WebClientRequestException
                    || cursor instanceof PrematureCloseException
                    || cursor instanceof TimeoutException) {
                return true;
            }
            if (cursor instanceof ExternalServiceException) {
                return false;
            }
            cursor = cursor.getCause();
        }
        return false;
    }

    static Throwable rootCause(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null && cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        return cursor;
    }

    private static String messageOf(Throwable throwable) {
        Throwable root = rootCause(throwable);
        if (root == null) return "unknown";
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}

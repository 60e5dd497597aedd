package com.example.legalrag.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Backoff policy shared by the outbound HTTP clients: 429, 5xx, timeouts and connection errors are
 * retried with exponential backoff plus jitter; any other status fails straight away.
 */
@Slf4j
public final class HttpRetries {

    private static final double JITTER = 0.5;

    private HttpRetries() {}

    /**
     * @param maxAttempts    total attempts including the first one
     * @param initialBackoff delay before the first retry, doubled on each subsequent one
     * @param maxBackoff     upper bound on a single delay
     * @param target         label for the log line
     */
    public static RetryBackoffSpec transientBackoff(int maxAttempts, Duration initialBackoff,
                                                    Duration maxBackoff, String target) {
        return Retry.backoff(Math.max(0, maxAttempts - 1), initialBackoff)
            .maxBackoff(maxBackoff)
            .jitter(JITTER)
            .filter(HttpRetries::isTransient)
            .doBeforeRetry(signal -> log.warn("Retrying {} (attempt {}): {}",
                target, signal.totalRetries() + 2, signal.failure().toString()))
            .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    public static boolean isTransient(Throwable t) {
        if (t instanceof WebClientResponseException e) {
            int status = e.getStatusCode().value();
            return status == 429 || (status >= 500 && status <= 599);
        }
        return t instanceof WebClientRequestException || t instanceof TimeoutException;
    }

    public static Integer statusOf(Throwable t) {
        return t instanceof WebClientResponseException e ? e.getStatusCode().value() : null;
    }
}

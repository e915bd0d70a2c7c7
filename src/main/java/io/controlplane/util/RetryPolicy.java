package io.controlplane.util;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bounded retry with exponential backoff.
 */
@Slf4j
@Getter
@Builder
public class RetryPolicy {

    @Builder.Default
    private final int maxAttempts = 10;
    @Builder.Default
    private final Duration initialDelay = Duration.ofMillis(100);
    @Builder.Default
    private final double multiplier = 2.0;
    @Builder.Default
    private final Duration maxDelay = Duration.ofSeconds(5);
    @Builder.Default
    private final Sleeper sleeper = Thread::sleep;

    /**
     * A task that may throw any exception.
     */
    @FunctionalInterface
    public interface CheckedRunnable {
        void run() throws Exception;
    }

    /**
     * Sleep hook so tests do not need to wait out real delays.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public <T> T call(String operation, Callable<T> task) throws RetryException {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        long delayMs = initialDelay.toMillis();
        Exception lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return task.call();
            } catch (Exception e) {
                lastError = e;
                if (attempt == maxAttempts) {
                    break;
                }
                log.debug("{} failed on attempt {}/{}, retrying in {}ms: {}",
                    operation, attempt, maxAttempts, delayMs, e.getMessage());
                try {
                    sleeper.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryException(operation + " interrupted while retrying", attempt, ie);
                }
                delayMs = Math.min((long) (delayMs * multiplier), maxDelay.toMillis());
            }
        }
        log.error("{} failed after {} attempts: {}", operation, maxAttempts, lastError.getMessage());
        throw new RetryException(operation + " failed after " + maxAttempts + " attempts", maxAttempts, lastError);
    }

    public void run(String operation, CheckedRunnable task) throws RetryException {
        call(operation, () -> {
            task.run();
            return null;
        });
    }
}

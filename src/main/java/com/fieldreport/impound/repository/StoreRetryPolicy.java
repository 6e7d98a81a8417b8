package com.fieldreport.impound.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff and jitter for transient store faults.
 *
 * Only safe for reads and for writes whose outcome the caller can re-check.
 */
@Component
@Slf4j
public class StoreRetryPolicy {

    private static final long MAX_DELAY_MS = 5_000L;

    private final int maxRetries;
    private final long retryDelayMs;

    public StoreRetryPolicy(
            @Value("${app.store.max-retries:3}") int maxRetries,
            @Value("${app.store.retry-delay-ms:100}") long retryDelayMs) {
        this.maxRetries = maxRetries;
        this.retryDelayMs = retryDelayMs;
        log.info("StoreRetryPolicy initialized with maxRetries: {}, retryDelayMs: {}ms", maxRetries, retryDelayMs);
    }

    public int maxRetries() {
        return maxRetries;
    }

    /**
     * Faults worth another attempt: the store may answer differently a moment later.
     */
    public boolean isTransient(DataAccessException e) {
        return e instanceof TransientDataAccessException
                || e instanceof DataAccessResourceFailureException
                || e instanceof RecoverableDataAccessException;
    }

    /**
     * Run a read, retrying transient faults up to {@code maxRetries} times.
     * Non-transient faults and the last transient one propagate unchanged.
     */
    public <T> T execute(String operationName, Supplier<T> operation) {
        int attempt = 0;
        final int totalAttempts = maxRetries + 1;
        while (true) {
            try {
                attempt++;
                return operation.get();
            } catch (DataAccessException e) {
                if (!isTransient(e) || attempt > maxRetries) {
                    log.error("Operation '{}' failed after {} attempts: {}", operationName, attempt, e.getMessage());
                    throw e;
                }
                long delay = backoffDelay(attempt);
                log.warn("Operation '{}' failed (attempt {}/{}), retrying in {}ms: {}",
                        operationName, attempt, totalAttempts, delay, e.getMessage());
                if (!sleep(delay)) {
                    throw e;
                }
            }
        }
    }

    /**
     * base * 2^(attempt-1) plus jitter, capped.
     */
    public long backoffDelay(int attempt) {
        long baseDelay = retryDelayMs * (1L << Math.min(Math.max(attempt - 1, 0), 16));
        long jitterBound = Math.max(1L, Math.min(1000L, baseDelay));
        long jitter = ThreadLocalRandom.current().nextLong(0, jitterBound);
        return Math.min(baseDelay + jitter, MAX_DELAY_MS);
    }

    /**
     * @return false if interrupted; the interrupt flag is restored
     */
    public boolean sleep(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

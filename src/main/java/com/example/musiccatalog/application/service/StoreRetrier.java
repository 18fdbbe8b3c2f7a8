package com.example.musiccatalog.application.service;

import com.example.musiccatalog.common.config.AppStoreProperties;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

/**
 * Runs catalog store calls, retrying connection-level failures with linear backoff.
 */
@Component
public class StoreRetrier {

    private static final Logger log = LoggerFactory.getLogger(StoreRetrier.class);

    private final AppStoreProperties appStoreProperties;

    public StoreRetrier(AppStoreProperties appStoreProperties) {
        this.appStoreProperties = appStoreProperties;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        int maxAttempts = Math.max(1, appStoreProperties.getMaxRetry());
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (!isTransient(e)) {
                    throw e;
                }
                lastError = e;
                log.warn("Store call failed, operation={}, attempt={}/{}, reason={}",
                        operation, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    sleepRetryBackoff(attempt);
                }
            }
        }
        throw lastError;
    }

    public void run(String operation, Runnable call) {
        execute(operation, () -> {
            call.run();
            return null;
        });
    }

    /**
     * {@link #run} for inserts guarded by a unique key. A connection can drop after the server
     * committed a row but before the client saw it; the retry then hits the unique key. A duplicate
     * on a retry therefore means the row is written. A duplicate on the first attempt is rethrown.
     */
    public void runInsert(String operation, Runnable call) {
        AtomicInteger attempts = new AtomicInteger();
        try {
            run(operation, () -> {
                attempts.incrementAndGet();
                call.run();
            });
        } catch (DuplicateKeyException e) {
            if (attempts.get() <= 1) {
                throw e;
            }
            log.warn("STORE_INSERT_ALREADY_COMMITTED operation={} attempts={}", operation, attempts.get());
        }
    }

    public boolean isTransient(Throwable e) {
        return e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException;
    }

    private void sleepRetryBackoff(int attempt) {
        long backoff = Math.max(0L, appStoreProperties.getRetryBackoffMs());
        try {
            Thread.sleep(backoff * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Store retry interrupted", e);
        }
    }
}

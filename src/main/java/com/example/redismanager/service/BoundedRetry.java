package com.example.redismanager.service;

import com.example.redismanager.error.ErrorKind;
import com.example.redismanager.error.ManagerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.util.function.Supplier;

/**
 * Runs a backend call up to {@code 1 + maxRetries} times, back to back, and returns the
 * first successful result.
 * <p>
 * Only {@link DataAccessException} is retried. A {@link ManagerException} thrown by the
 * action is a final answer and passes through untouched; any other runtime failure is
 * reported as {@link ErrorKind#UNKNOWN_INTERNAL}.
 */
public final class BoundedRetry {

    private static final Logger logger = LoggerFactory.getLogger(BoundedRetry.class);

    private BoundedRetry() {
    }

    public static <T> T call(int maxRetries, String description, Supplier<T> action) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        int attempts = maxRetries + 1;
        DataAccessException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return action.get();
            } catch (ManagerException e) {
                throw e;
            } catch (DataAccessException e) {
                lastFailure = e;
                logger.warn("{} failed on attempt {}/{}: {}", description, attempt, attempts, e.getMessage());
            } catch (RuntimeException e) {
                throw new ManagerException(ErrorKind.UNKNOWN_INTERNAL,
                        "Unexpected failure during " + description + ".", e);
            }
        }
        throw new ManagerException(ErrorKind.BACKEND_INTERNAL,
                "Failed to " + description + " after " + attempts + " attempts.", lastFailure);
    }
}

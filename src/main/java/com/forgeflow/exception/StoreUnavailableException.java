package com.forgeflow.exception;

import io.r2dbc.spi.R2dbcNonTransientResourceException;
import io.r2dbc.spi.R2dbcTransientResourceException;
import org.springframework.dao.DataAccessResourceFailureException;

/**
 * Exception thrown when the backing database cannot be reached.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(Throwable cause) {
        super("Database not available", cause);
    }

    /**
     * Whether an error raised by the store means the store itself is unreachable,
     * as opposed to a problem with the statement or data.
     */
    public static boolean isUnavailable(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof DataAccessResourceFailureException
                    || t instanceof R2dbcNonTransientResourceException
                    || t instanceof R2dbcTransientResourceException
                    || t instanceof java.net.ConnectException) {
                return true;
            }
        }
        return false;
    }
}

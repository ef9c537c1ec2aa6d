package com.stresscast.scenario.repository;

/**
 * Raised when the historical data store cannot be read. Never replaced by default data.
 */
public class DataSourceException extends RuntimeException {

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }

    public static DataSourceException fetchFailed(String dataset, Throwable cause) {
        String reason = cause != null && cause.getMessage() != null ? cause.getMessage() : "unknown error";
        return new DataSourceException("Failed to fetch " + dataset + ": " + reason, cause);
    }
}

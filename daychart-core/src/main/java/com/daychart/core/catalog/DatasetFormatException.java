package com.daychart.core.catalog;

/**
 * Thrown when a dataset does not have the expected shape.
 * This is never a per-record outcome: the whole load is aborted.
 */
public class DatasetFormatException extends RuntimeException {

    public DatasetFormatException(String message) {
        super(message);
    }

    public DatasetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

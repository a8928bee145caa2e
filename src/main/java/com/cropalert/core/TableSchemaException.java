package com.cropalert.core;

/**
 * Structural problem with the input table (missing {@code date} column, unparseable or duplicate dates).
 * Always aborts the run; no partial output is written.
 */
public class TableSchemaException extends RuntimeException {

    public TableSchemaException(String message) {
        super(message);
    }

    public TableSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.datahub.calgroup.exception;

/**
 * Base class for failures that abort a whole reconciliation cycle.
 * Per-record problems never surface as exceptions; they are logged and skipped.
 */
public class SyncException extends RuntimeException {

    public SyncException(String message) {
        super(message);
    }

    public SyncException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.datahub.calgroup.exception;

/**
 * A hub request timed out, could not connect, got no fetch slot or returned an error status.
 */
public class HubTransportException extends SyncException {

    public HubTransportException(String message) {
        super(message);
    }

    public HubTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

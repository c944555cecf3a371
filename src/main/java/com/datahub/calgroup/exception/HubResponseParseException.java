package com.datahub.calgroup.exception;

public class HubResponseParseException extends SyncException {

    public HubResponseParseException(String message) {
        super(message);
    }

    public HubResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.datahub.calgroup.exception;

public class GrouperResponseParseException extends SyncException {

    public GrouperResponseParseException(String message) {
        super(message);
    }

    public GrouperResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}

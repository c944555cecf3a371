package com.datahub.calgroup.exception;

/** The group directory could not be reached. */
public class GrouperTransportException extends SyncException {

    public GrouperTransportException(String message) {
        super(message);
    }

    public GrouperTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

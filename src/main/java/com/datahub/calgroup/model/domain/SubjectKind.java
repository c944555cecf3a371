package com.datahub.calgroup.model.domain;

/**
 * How a member is identified to the group directory.
 */
public enum SubjectKind {

    /** Opaque directory key, e.g. a numeric id. */
    SUBJECT_ID("subjectId"),

    /** Human readable path such as an email address or group path. */
    SUBJECT_IDENTIFIER("subjectIdentifier");

    private final String lookupKey;

    SubjectKind(String lookupKey) {
        this.lookupKey = lookupKey;
    }

    public String getLookupKey() {
        return lookupKey;
    }
}

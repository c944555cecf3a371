package com.datahub.calgroup.model.dto;

import com.datahub.calgroup.model.domain.SubjectKind;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A principal as the group directory should look it up.
 *
 * Classification is a plain pattern match: anything made only of ASCII letters
 * and digits is treated as a subject id, everything else (emails, group paths
 * with separators) as a subject identifier. An all-alphabetic group path
 * therefore also classifies as a subject id.
 */
public record MemberIdentifier(String value, SubjectKind kind) {

    private static final Pattern SUBJECT_ID = Pattern.compile("[A-Za-z0-9]+");

    public MemberIdentifier {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(kind, "kind");
    }

    public static MemberIdentifier classify(String value) {
        SubjectKind kind = SUBJECT_ID.matcher(value).matches()
                ? SubjectKind.SUBJECT_ID
                : SubjectKind.SUBJECT_IDENTIFIER;
        return new MemberIdentifier(value, kind);
    }
}

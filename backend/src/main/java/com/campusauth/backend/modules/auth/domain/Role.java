package com.campusauth.backend.modules.auth.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Directory role of a user. Stored by name, exposed in lower case.
 */
public enum Role {
    ADMIN,
    TEACHER,
    STUDENT,
    STAFF;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("role must not be blank");
        }
        try {
            return Role.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown role: " + code, ex);
        }
    }
}

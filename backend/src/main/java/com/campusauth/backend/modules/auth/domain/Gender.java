package com.campusauth.backend.modules.auth.domain;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Gender {
    MALE,
    FEMALE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Gender fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("gender must not be blank");
        }
        try {
            return Gender.valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unknown gender: " + code, ex);
        }
    }
}

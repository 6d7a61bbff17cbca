package com.campusauth.backend.modules.auth.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Capabilities embedded in access tokens. The wire form is the {@code resource:action} code.
 */
public enum Permission {
    USERS_READ("users:read"),
    USERS_CREATE("users:create"),
    USERS_UPDATE("users:update"),
    USERS_DELETE("users:delete"),
    PROFILE_READ("profile:read"),
    TOKENS_VERIFY("tokens:verify"),
    GRADES_READ("grades:read"),
    GRADES_WRITE("grades:write"),
    SCHEDULE_READ("schedule:read"),
    SCHEDULE_WRITE("schedule:write");

    private final String code;

    Permission(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static Permission fromCode(String code) {
        return Arrays.stream(values())
                .filter(permission -> permission.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown permission: " + code));
    }
}

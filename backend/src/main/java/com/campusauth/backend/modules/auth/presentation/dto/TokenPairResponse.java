package com.campusauth.backend.modules.auth.presentation.dto;

public record TokenPairResponse(
        String accessToken,
        String refreshToken,
        long expiresIn,
        String tokenType
) {
    public static final String DEFAULT_TOKEN_TYPE = "bearer";
}

package com.campusauth.backend.global.security;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;

public final class SecurityUtils {

    private static final String BEARER_PREFIX = "Bearer ";

    private SecurityUtils() {
    }

    /**
     * Returns the bearer credential of the request, or {@code null} when the header is absent
     * or uses another scheme.
     */
    public static String resolveBearerToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || authorization.length() <= BEARER_PREFIX.length()
                || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}

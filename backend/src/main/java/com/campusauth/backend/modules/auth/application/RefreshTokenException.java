package com.campusauth.backend.modules.auth.application;

/**
 * Internal refresh-store failure. The reason is for logs only; callers collapse every
 * failure into one 401.
 */
public class RefreshTokenException extends RuntimeException {

    public enum Failure {
        NOT_FOUND,
        REVOKED,
        EXPIRED
    }

    private final Failure failure;

    public RefreshTokenException(Failure failure) {
        super("Refresh token rejected: " + failure);
        this.failure = failure;
    }

    public Failure getFailure() {
        return failure;
    }
}

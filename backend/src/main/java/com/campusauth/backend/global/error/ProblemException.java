package com.campusauth.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Business failure carrying a stable machine-readable code, rendered as problem+json by
 * {@link RestExceptionHandler}.
 */
public class ProblemException extends ResponseStatusException {

    private final HttpStatus status;
    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.status = status;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public HttpStatus getHttpStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public ProblemResponse toResponse(String instance) {
        return ProblemResponse.of(status, code, detail, instance);
    }
}

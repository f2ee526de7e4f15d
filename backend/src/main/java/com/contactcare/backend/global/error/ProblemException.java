package com.contactcare.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Business failure carrying a stable machine-readable code alongside the HTTP status.
 * The code is what API clients switch on; the detail is for humans and may change.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detailMessage;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, null);
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, null);
    }

    public ProblemException(HttpStatus status, String code, String detail, Throwable cause) {
        super(status, requireCode(code), cause);
        this.code = code;
        this.detailMessage = detail == null || detail.isBlank() ? code : detail;
    }

    public static ProblemException notFound(String code, Object id) {
        return new ProblemException(HttpStatus.NOT_FOUND, code, code + ": " + id);
    }

    public static ProblemException conflict(String code, String detail) {
        return new ProblemException(HttpStatus.CONFLICT, code, detail);
    }

    public static ProblemException unprocessable(String code, String detail) {
        return new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, code, detail);
    }

    private static String requireCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("problem code must not be blank");
        }
        return code;
    }

    public HttpStatus getHttpStatus() {
        return HttpStatus.valueOf(getStatusCode().value());
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detailMessage;
    }
}

package com.contactcare.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;

/**
 * RFC 7807 style body returned for every failed request.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    static final String TYPE_BASE = "https://contactcare.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String resolvedCode = code == null || code.isBlank() ? httpStatus.name() : code;
        String resolvedDetail = detail == null || detail.isBlank() ? httpStatus.getReasonPhrase() : detail;
        return new ProblemResponse(
                typeFor(resolvedCode),
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                resolvedDetail,
                instance,
                resolvedCode
        );
    }

    public static ProblemResponse of(ProblemException ex, String instance) {
        return of(ex.getHttpStatus(), ex.getCode(), ex.getDetailMessage(), instance);
    }

    static String typeFor(String code) {
        return TYPE_BASE + code.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}

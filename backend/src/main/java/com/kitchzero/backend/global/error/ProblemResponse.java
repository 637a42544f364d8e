package com.kitchzero.backend.global.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.springframework.http.HttpStatus;

/**
 * Error body shared by MVC handlers and filters. {@code retryAfterSeconds} is present only on problems the
 * client may retry, mirroring the {@code Retry-After} header.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        Long retryAfterSeconds
) {

    private static final String TYPE_BASE = "https://kitchzero.app/problems/";

    public static ProblemResponse of(HttpStatus status, String code, String detail, String instance) {
        String publicCode = (code == null || code.isBlank()) ? status.name() : code;
        String publicDetail = (detail == null || detail.isBlank()) ? status.getReasonPhrase() : detail;
        String slug = publicCode.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
        return new ProblemResponse(TYPE_BASE + slug, status.getReasonPhrase(), status.value(), publicDetail,
                instance, publicCode, null);
    }

    public static ProblemResponse of(ProblemException ex, String instance) {
        ProblemResponse base = of(ex.getHttpStatus(), ex.getCode(), ex.getDetailMessage(), instance);
        if (ex instanceof RetryableProblemException retryable) {
            return new ProblemResponse(base.type(), base.title(), base.status(), base.detail(), base.instance(),
                    base.code(), retryable.getRetryAfterSeconds());
        }
        return base;
    }
}

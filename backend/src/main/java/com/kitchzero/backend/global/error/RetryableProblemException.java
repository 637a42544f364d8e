package com.kitchzero.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A problem the client may retry once {@link #getRetryAfterSeconds()} have elapsed. Rendered with a
 * {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    private final long retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, long retryAfterSeconds) {
        super(status, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

package com.kitchzero.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Internal failure taxonomy of the identity core and the public face each failure is given.
 * Several internal codes deliberately collapse onto the same public code so that responses do not reveal
 * which check failed.
 */
public enum AuthErrorCode {

    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "AUTHENTICATION_FAILED", "Invalid username or password"),
    ACCOUNT_LOCKED(HttpStatus.UNAUTHORIZED, "AUTHENTICATION_FAILED", "Too many failed attempts. Please try again later"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "LOGIN_REQUIRED", "Please log in again"),
    SESSION_EXPIRED(HttpStatus.UNAUTHORIZED, "LOGIN_REQUIRED", "Please log in again"),
    SESSION_NOT_FOUND(HttpStatus.UNAUTHORIZED, "LOGIN_REQUIRED", "Please log in again"),
    REUSE_DETECTED(HttpStatus.UNAUTHORIZED, "LOGIN_REQUIRED", "Please log in again"),
    STORE_UNAVAILABLE(HttpStatus.UNAUTHORIZED, "LOGIN_REQUIRED", "Please log in again"),
    CSRF_MISMATCH(HttpStatus.FORBIDDEN, "REQUEST_DENIED", "Request denied"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "REQUEST_DENIED", "Request denied"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", "Too many requests. Please try again later");

    private final HttpStatus status;
    private final String publicCode;
    private final String publicDetail;

    AuthErrorCode(HttpStatus status, String publicCode, String publicDetail) {
        this.status = status;
        this.publicCode = publicCode;
        this.publicDetail = publicDetail;
    }

    public HttpStatus status() {
        return status;
    }

    public String publicCode() {
        return publicCode;
    }

    public String publicDetail() {
        return publicDetail;
    }
}

package com.kitchzero.backend.global.error;

/**
 * Failure raised by the identity core. The HTTP rendering only ever uses the public code and detail of
 * {@link AuthErrorCode}; {@link #getErrorCode()} stays server-side for logging and tests.
 */
public class AuthException extends ProblemException {

    private final AuthErrorCode errorCode;

    public AuthException(AuthErrorCode errorCode) {
        this(errorCode, null);
    }

    public AuthException(AuthErrorCode errorCode, Throwable cause) {
        super(errorCode.status(), errorCode.publicCode(), errorCode.publicDetail(), cause);
        this.errorCode = errorCode;
    }

    public AuthErrorCode getErrorCode() {
        return errorCode;
    }
}

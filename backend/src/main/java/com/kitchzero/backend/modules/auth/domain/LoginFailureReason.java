package com.kitchzero.backend.modules.auth.domain;

public enum LoginFailureReason {
    USER_NOT_FOUND,
    INVALID_PASSWORD
}

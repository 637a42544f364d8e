package com.kitchzero.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;

import com.kitchzero.backend.modules.auth.application.IssuedSession;

public record LoginResponse(UserProfileResponse user, OffsetDateTime accessExpiresAt, OffsetDateTime refreshExpiresAt) {

    public static LoginResponse from(IssuedSession session) {
        return new LoginResponse(
                UserProfileResponse.from(session.user()),
                session.accessToken().expiresAt(),
                session.refreshToken().expiresAt()
        );
    }
}

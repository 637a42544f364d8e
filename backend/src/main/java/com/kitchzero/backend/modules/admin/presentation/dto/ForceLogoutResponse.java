package com.kitchzero.backend.modules.admin.presentation.dto;

public record ForceLogoutResponse(int invalidatedSessions) {
}

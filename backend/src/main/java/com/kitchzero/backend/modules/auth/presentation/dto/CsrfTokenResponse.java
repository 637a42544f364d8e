package com.kitchzero.backend.modules.auth.presentation.dto;

public record CsrfTokenResponse(String csrfToken) {
}

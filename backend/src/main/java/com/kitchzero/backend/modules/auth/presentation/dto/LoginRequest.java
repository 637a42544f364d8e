package com.kitchzero.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank(message = "username is required") @Size(max = 50) String username,
        @NotBlank(message = "password is required") @Size(max = 128) String password
) {
}

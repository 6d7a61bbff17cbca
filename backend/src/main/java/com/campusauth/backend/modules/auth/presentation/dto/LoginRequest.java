package com.campusauth.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record LoginRequest(
        @NotBlank(message = "login is required") @Size(max = 255) String login,
        @NotBlank(message = "password is required") @Size(max = 1024) String password
) {
}

package com.campusauth.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record LogoutRequest(@NotBlank(message = "refresh_token is required") String refreshToken) {
}

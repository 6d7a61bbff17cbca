package com.campusauth.backend.modules.users.presentation.dto;

import com.campusauth.backend.modules.auth.domain.Gender;
import com.campusauth.backend.modules.auth.domain.Role;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @NotBlank(message = "last_name is required") @Size(max = 255) String lastName,
        @NotBlank(message = "first_name is required") @Size(max = 255) String firstName,
        @Size(max = 255) String middleName,
        @NotBlank(message = "login is required") @Size(max = 255) String login,
        @NotBlank(message = "password is required") @Size(max = 1024) String password,
        @NotNull(message = "role is required") Role role,
        @NotNull(message = "gender is required") Gender gender,
        @Size(max = 64) String className,
        @Min(1900) @Max(2200) Integer graduationYear
) {
}

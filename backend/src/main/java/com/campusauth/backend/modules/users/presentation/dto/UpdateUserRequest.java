package com.campusauth.backend.modules.users.presentation.dto;

import com.campusauth.backend.modules.auth.domain.Gender;
import com.campusauth.backend.modules.auth.domain.Role;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update. Absent (null) fields keep their stored value.
 */
public record UpdateUserRequest(
        @Size(min = 1, max = 255) String lastName,
        @Size(min = 1, max = 255) String firstName,
        @Size(max = 255) String middleName,
        @Size(min = 1, max = 255) @Pattern(regexp = ".*\\S.*", message = "login must not be blank") String login,
        @Size(min = 1, max = 1024) String password,
        Role role,
        Gender gender,
        @Size(max = 64) String className,
        @Min(1900) @Max(2200) Integer graduationYear
) {
}

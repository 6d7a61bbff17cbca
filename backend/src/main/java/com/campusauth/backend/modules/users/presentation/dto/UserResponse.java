package com.campusauth.backend.modules.users.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.campusauth.backend.modules.auth.domain.CampusUser;
import com.campusauth.backend.modules.auth.domain.Gender;
import com.campusauth.backend.modules.auth.domain.Role;

public record UserResponse(
        UUID id,
        String lastName,
        String firstName,
        String middleName,
        String login,
        Role role,
        Gender gender,
        String className,
        Integer graduationYear,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserResponse from(CampusUser user) {
        return new UserResponse(
                user.getId(),
                user.getLastName(),
                user.getFirstName(),
                user.getMiddleName(),
                user.getLogin(),
                user.getRole(),
                user.getGender(),
                user.getClassName(),
                user.getGraduationYear(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}

package com.campusauth.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.campusauth.backend.modules.auth.domain.Permission;
import com.campusauth.backend.modules.auth.domain.Role;

public record VerifyResponse(UUID userId, Role role, List<Permission> permissions) {
}

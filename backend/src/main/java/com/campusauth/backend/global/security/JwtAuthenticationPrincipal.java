package com.campusauth.backend.global.security;

import java.util.Set;
import java.util.UUID;

import com.campusauth.backend.modules.auth.domain.Permission;
import com.campusauth.backend.modules.auth.domain.Role;

public record JwtAuthenticationPrincipal(UUID userId, Role role, Set<Permission> permissions) {
}

package com.campusauth.backend.modules.users.presentation.dto;

import java.util.List;

public record UserListResponse(List<UserResponse> items, long total, int offset, int limit) {
}

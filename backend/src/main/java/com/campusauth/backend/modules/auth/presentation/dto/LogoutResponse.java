package com.campusauth.backend.modules.auth.presentation.dto;

public record LogoutResponse(boolean ok) {

    public static final LogoutResponse OK = new LogoutResponse(true);
}

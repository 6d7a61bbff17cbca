package com.campusauth.backend.modules.auth.presentation;

import com.campusauth.backend.global.security.JwtAuthenticationPrincipal;
import com.campusauth.backend.global.security.SecurityUtils;
import com.campusauth.backend.modules.auth.application.AuthService;
import com.campusauth.backend.modules.auth.presentation.dto.LoginRequest;
import com.campusauth.backend.modules.auth.presentation.dto.LogoutRequest;
import com.campusauth.backend.modules.auth.presentation.dto.LogoutResponse;
import com.campusauth.backend.modules.auth.presentation.dto.RefreshRequest;
import com.campusauth.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.campusauth.backend.modules.auth.presentation.dto.VerifyResponse;
import com.campusauth.backend.modules.users.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Log in", description = "Exchanges login and password for an access/refresh token pair.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token pair issued"),
            @ApiResponse(responseCode = "401", description = "Invalid login or password"),
            @ApiResponse(responseCode = "503", description = "Hashing pool saturated, retry later")
    })
    @PostMapping("/login")
    public ResponseEntity<TokenPairResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @Operation(summary = "Rotate refresh token", description = "Consumes a refresh token and issues a new pair.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New token pair issued"),
            @ApiResponse(responseCode = "401", description = "Refresh token unknown, revoked or expired")
    })
    @PostMapping("/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @Operation(summary = "Log out", description = "Revokes the caller's refresh token. Always answers ok.")
    @PostMapping("/logout")
    public ResponseEntity<LogoutResponse> logout(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody LogoutRequest request
    ) {
        authService.logout(request, principal.userId());
        return ResponseEntity.ok(LogoutResponse.OK);
    }

    @Operation(summary = "Verify access token", description = "Decodes the bearer token without touching storage.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token is valid"),
            @ApiResponse(responseCode = "401", description = "Token invalid or expired")
    })
    @PostMapping("/verify")
    public ResponseEntity<VerifyResponse> verify(HttpServletRequest request) {
        return ResponseEntity.ok(authService.verify(SecurityUtils.resolveBearerToken(request)));
    }

    @Operation(summary = "Current user", description = "Returns the directory record of the token's subject.")
    @GetMapping("/me")
    public ResponseEntity<UserResponse> currentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.loadCurrentUser(principal.userId()));
    }
}

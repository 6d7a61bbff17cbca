package com.campusauth.backend.modules.users.presentation;

import java.net.URI;
import java.util.UUID;

import com.campusauth.backend.modules.users.application.UserDirectoryService;
import com.campusauth.backend.modules.users.presentation.dto.CreateUserRequest;
import com.campusauth.backend.modules.users.presentation.dto.UpdateUserRequest;
import com.campusauth.backend.modules.users.presentation.dto.UserListResponse;
import com.campusauth.backend.modules.users.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private final UserDirectoryService userDirectoryService;

    public UserController(UserDirectoryService userDirectoryService) {
        this.userDirectoryService = userDirectoryService;
    }

    @Operation(summary = "List users", description = "Paged listing ordered by creation time.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page returned"),
            @ApiResponse(responseCode = "403", description = "Admin role required")
    })
    @GetMapping
    public ResponseEntity<UserListResponse> list(
            @RequestParam(value = "offset", required = false) Integer offset,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(userDirectoryService.list(offset, limit));
    }

    @Operation(summary = "Get user")
    @GetMapping("/{userId}")
    public ResponseEntity<UserResponse> get(@PathVariable UUID userId) {
        return ResponseEntity.ok(userDirectoryService.get(userId));
    }

    @Operation(summary = "Create user")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "User created"),
            @ApiResponse(responseCode = "409", description = "Login already exists"),
            @ApiResponse(responseCode = "422", description = "Validation failed")
    })
    @PostMapping
    public ResponseEntity<UserResponse> create(@Valid @RequestBody CreateUserRequest request) {
        UserResponse created = userDirectoryService.create(request);
        return ResponseEntity.created(URI.create("/users/" + created.id())).body(created);
    }

    @Operation(summary = "Update user", description = "Partial update; a new password is re-hashed.")
    @PatchMapping("/{userId}")
    public ResponseEntity<UserResponse> update(
            @PathVariable UUID userId,
            @Valid @RequestBody UpdateUserRequest request
    ) {
        return ResponseEntity.ok(userDirectoryService.update(userId, request));
    }

    @Operation(summary = "Delete user", description = "Revokes every refresh token of the user, then removes it.")
    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> delete(@PathVariable UUID userId) {
        userDirectoryService.delete(userId);
        return ResponseEntity.noContent().build();
    }
}

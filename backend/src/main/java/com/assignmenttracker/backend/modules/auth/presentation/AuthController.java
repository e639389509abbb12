package com.assignmenttracker.backend.modules.auth.presentation;

import com.assignmenttracker.backend.modules.auth.application.AuthService;
import com.assignmenttracker.backend.modules.auth.presentation.dto.LoginRequest;
import com.assignmenttracker.backend.modules.auth.presentation.dto.LoginResponse;
import com.assignmenttracker.backend.modules.auth.presentation.dto.RegisterRequest;
import com.assignmenttracker.backend.modules.auth.presentation.dto.UserProfileResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register a username and password")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "User registered"),
            @ApiResponse(responseCode = "409", description = "Username taken, code `IDENTITY_ALREADY_EXISTS`")
    })
    @PostMapping("/auth/register")
    public ResponseEntity<UserProfileResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @Operation(
            summary = "Exchange credentials for a bearer token",
            description = """
                    Unknown usernames and wrong passwords both return 401 `INVALID_CREDENTIALS`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token issued"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials")
    })
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }
}

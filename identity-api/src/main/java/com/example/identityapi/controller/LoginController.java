package com.example.identityapi.controller;

import com.example.identityapi.dto.LoginRequest;
import com.example.identityapi.service.LoginService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/login")
@Tag(name = "Login", description = "Access token issuance")
public class LoginController {

    private final LoginService loginService;

    public LoginController(LoginService loginService) {
        this.loginService = loginService;
    }

    /**
     * POST /api/v1/login/tokens
     *
     * @return 200 OK with the access token
     */
    @Operation(
            summary = "Log in",
            description = "Exchange user name and password for a JWT access token",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Token issued"),
                    @ApiResponse(responseCode = "400", description = "Invalid credentials or account not activated"),
                    @ApiResponse(responseCode = "404", description = "User not found")
            }
    )
    @PostMapping("/tokens")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request) {
        return ServiceResponses.ok(loginService.login(request));
    }
}

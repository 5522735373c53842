package com.hercare.backend.modules.auth.presentation;

import com.hercare.backend.modules.auth.application.AuthService;
import com.hercare.backend.modules.auth.presentation.dto.LoginRequest;
import com.hercare.backend.modules.auth.presentation.dto.LoginResponse;
import com.hercare.backend.modules.auth.presentation.dto.RegisterRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

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

    @Operation(summary = "환자/의사 셀프 가입")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "가입 완료, 액세스 토큰 발급"),
            @ApiResponse(responseCode = "409", description = "DUPLICATE_IDENTITY")
    })
    @PostMapping("/auth/register")
    public ResponseEntity<LoginResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }
}

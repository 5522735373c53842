package com.hercare.backend.modules.migration.presentation;

import com.hercare.backend.global.security.RequiresRole;
import com.hercare.backend.global.security.SecurityUtils;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.migration.application.ShadowIdentityMigrator;
import com.hercare.backend.modules.migration.presentation.dto.ClaimRequest;
import com.hercare.backend.modules.migration.presentation.dto.ClaimResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ShadowClaimController {

    private final ShadowIdentityMigrator migrator;

    public ShadowClaimController(ShadowIdentityMigrator migrator) {
        this.migrator = migrator;
    }

    @Operation(summary = "공유 코드로 의사가 등록한 기록 가져오기")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "MIGRATED 또는 ALREADY_LINKED"),
            @ApiResponse(responseCode = "404", description = "INVALID_CODE"),
            @ApiResponse(responseCode = "409", description = "ALREADY_MIGRATED")
    })
    @RequiresRole(UserRole.PATIENT)
    @PostMapping("/links/claim")
    public ResponseEntity<ClaimResponse> claim(@Valid @RequestBody ClaimRequest request) {
        return ResponseEntity.ok(migrator.claim(request.shareCode(), SecurityUtils.getCurrentUserId()));
    }
}

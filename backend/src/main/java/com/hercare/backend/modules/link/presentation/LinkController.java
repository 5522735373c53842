package com.hercare.backend.modules.link.presentation;

import java.util.List;
import java.util.UUID;

import com.hercare.backend.global.security.RequiresRole;
import com.hercare.backend.global.security.SecurityUtils;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.link.application.LinkRegistryService;
import com.hercare.backend.modules.link.presentation.dto.InviteLinkRequest;
import com.hercare.backend.modules.link.presentation.dto.LinkResponse;
import com.hercare.backend.modules.link.presentation.dto.LinkedDoctorResponse;
import com.hercare.backend.modules.link.presentation.dto.UpdatePermissionsRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/links")
public class LinkController {

    private final LinkRegistryService linkRegistryService;

    public LinkController(LinkRegistryService linkRegistryService) {
        this.linkRegistryService = linkRegistryService;
    }

    @Operation(summary = "초대 코드로 의사와 연결")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "연결 생성"),
            @ApiResponse(responseCode = "404", description = "INVALID_INVITE_CODE"),
            @ApiResponse(responseCode = "409", description = "ALREADY_LINKED")
    })
    @RequiresRole(UserRole.PATIENT)
    @PostMapping("/invite")
    public ResponseEntity<LinkResponse> linkViaInvite(@Valid @RequestBody InviteLinkRequest request) {
        LinkResponse response = linkRegistryService.createLinkViaInvite(SecurityUtils.getCurrentUserId(), request.inviteCode());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @RequiresRole(UserRole.PATIENT)
    @GetMapping("/doctors")
    public ResponseEntity<List<LinkedDoctorResponse>> myDoctors() {
        return ResponseEntity.ok(linkRegistryService.listMyDoctors(SecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "연결 권한 전체 교체")
    @RequiresRole(UserRole.PATIENT)
    @PutMapping("/{linkId}/permissions")
    public ResponseEntity<LinkResponse> updatePermissions(
            @PathVariable UUID linkId,
            @Valid @RequestBody UpdatePermissionsRequest request
    ) {
        return ResponseEntity.ok(linkRegistryService.setPermissions(linkId, SecurityUtils.getCurrentUserId(), request.permissions()));
    }

    @RequiresRole(UserRole.PATIENT)
    @PutMapping("/doctors/{doctorId}/permissions")
    public ResponseEntity<LinkResponse> updatePermissionsForDoctor(
            @PathVariable UUID doctorId,
            @Valid @RequestBody UpdatePermissionsRequest request
    ) {
        return ResponseEntity.ok(linkRegistryService.setPermissionsForDoctor(doctorId, SecurityUtils.getCurrentUserId(), request.permissions()));
    }
}

package com.hercare.backend.modules.link.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record InviteLinkRequest(
        @NotBlank(message = "inviteCode is required") @Size(max = 16) String inviteCode
) {
}

package com.hercare.backend.modules.link.presentation.dto;

import java.util.Map;

import jakarta.validation.constraints.NotNull;

/**
 * Keys are category codes ({@code health_logs}, {@code medications}, ...). Omitted or null keys are stored as unset.
 */
public record UpdatePermissionsRequest(
        @NotNull(message = "permissions is required") Map<String, Boolean> permissions
) {
}

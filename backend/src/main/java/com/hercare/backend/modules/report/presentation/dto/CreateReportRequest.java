package com.hercare.backend.modules.report.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateReportRequest(
        @NotBlank(message = "title is required") @Size(max = 200) String title,
        @Size(max = 50) String reportType,
        String notes,
        @Size(max = 255) String fileName,
        String fileData
) {
}

package com.hercare.backend.modules.dietplan.presentation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Create/update payload. {@code mealType} is one of breakfast, lunch, snack or dinner in practice.
 */
public record DietPlanRequest(
        @NotBlank(message = "mealType is required") @Size(max = 30) String mealType,
        @NotBlank(message = "foodItems is required") String foodItems,
        @Min(0) Integer calories,
        String notes,
        @Size(max = 16) String dayOfWeek
) {
}

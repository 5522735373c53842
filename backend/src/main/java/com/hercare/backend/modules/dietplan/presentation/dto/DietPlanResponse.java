package com.hercare.backend.modules.dietplan.presentation.dto;

import java.util.UUID;

import com.hercare.backend.modules.dietplan.domain.DietPlan;

public record DietPlanResponse(
        UUID id,
        UUID patientId,
        UUID createdBy,
        String mealType,
        String foodItems,
        Integer calories,
        String notes,
        String dayOfWeek
) {
    public static DietPlanResponse from(DietPlan plan) {
        return new DietPlanResponse(
                plan.getId(),
                plan.getPatientId(),
                plan.getCreatedBy(),
                plan.getMealType(),
                plan.getFoodItems(),
                plan.getCalories(),
                plan.getNotes(),
                plan.getDayOfWeek()
        );
    }
}

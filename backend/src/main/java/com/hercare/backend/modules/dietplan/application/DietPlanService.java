package com.hercare.backend.modules.dietplan.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.dietplan.domain.DietPlan;
import com.hercare.backend.modules.dietplan.infrastructure.persistence.DietPlanRepository;
import com.hercare.backend.modules.dietplan.presentation.dto.DietPlanRequest;
import com.hercare.backend.modules.dietplan.presentation.dto.DietPlanResponse;
import com.hercare.backend.modules.link.application.RecordAccessGuard;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.modules.migration.application.OwnedRecordReassigner;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class DietPlanService implements OwnedRecordReassigner {

    private final DietPlanRepository dietPlanRepository;
    private final RecordAccessGuard accessGuard;

    public DietPlanService(DietPlanRepository dietPlanRepository, RecordAccessGuard accessGuard) {
        this.dietPlanRepository = dietPlanRepository;
        this.accessGuard = accessGuard;
    }

    public DietPlanResponse create(UUID requesterId, UUID patientId, DietPlanRequest request) {
        accessGuard.checkWrite(requesterId, patientId, ResourceCategory.DIET_PLANS);

        DietPlan plan = new DietPlan();
        plan.setPatientId(patientId);
        plan.setCreatedBy(requesterId);
        apply(plan, request);
        return DietPlanResponse.from(dietPlanRepository.saveAndFlush(plan));
    }

    @Transactional(readOnly = true)
    public List<DietPlanResponse> list(UUID requesterId, UUID patientId) {
        accessGuard.checkRead(requesterId, patientId, ResourceCategory.DIET_PLANS);
        return dietPlanRepository.findByPatientId(patientId).stream()
                .map(DietPlanResponse::from)
                .toList();
    }

    public DietPlanResponse update(UUID requesterId, UUID planId, DietPlanRequest request) {
        DietPlan plan = load(planId);
        accessGuard.checkWrite(requesterId, plan.getPatientId(), ResourceCategory.DIET_PLANS);
        apply(plan, request);
        return DietPlanResponse.from(dietPlanRepository.saveAndFlush(plan));
    }

    public void delete(UUID requesterId, UUID planId) {
        DietPlan plan = load(planId);
        accessGuard.checkWrite(requesterId, plan.getPatientId(), ResourceCategory.DIET_PLANS);
        dietPlanRepository.delete(plan);
    }

    @Override
    public ResourceCategory category() {
        return ResourceCategory.DIET_PLANS;
    }

    @Override
    public int reassign(UUID shadowPatientId, UUID realPatientId, OffsetDateTime now) {
        return dietPlanRepository.reassignPatient(shadowPatientId, realPatientId, now);
    }

    // meal type and food items are required; the optional fields keep their value when omitted
    private static void apply(DietPlan plan, DietPlanRequest request) {
        plan.setMealType(request.mealType());
        plan.setFoodItems(request.foodItems());
        if (request.calories() != null) {
            plan.setCalories(request.calories());
        }
        if (request.notes() != null) {
            plan.setNotes(request.notes());
        }
        if (request.dayOfWeek() != null) {
            plan.setDayOfWeek(request.dayOfWeek());
        }
    }

    private DietPlan load(UUID planId) {
        return dietPlanRepository.findById(planId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "DIET_PLAN_NOT_FOUND"));
    }
}

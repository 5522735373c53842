package com.hercare.backend.modules.dietplan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.dietplan.application.DietPlanService;
import com.hercare.backend.modules.dietplan.domain.DietPlan;
import com.hercare.backend.modules.dietplan.infrastructure.persistence.DietPlanRepository;
import com.hercare.backend.modules.dietplan.presentation.dto.DietPlanRequest;
import com.hercare.backend.modules.dietplan.presentation.dto.DietPlanResponse;
import com.hercare.backend.modules.link.application.RecordAccessGuard;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class DietPlanServiceTest {

    private static final UUID DOCTOR = UUID.fromString("00000000-0000-0000-0000-0000000000d1");
    private static final UUID PATIENT = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    @Mock
    private DietPlanRepository dietPlanRepository;

    @Mock
    private RecordAccessGuard accessGuard;

    private DietPlanService service;

    @BeforeEach
    void setUp() {
        service = new DietPlanService(dietPlanRepository, accessGuard);
    }

    private static DietPlan existingPlan() {
        DietPlan plan = new DietPlan();
        plan.setPatientId(PATIENT);
        plan.setCreatedBy(DOCTOR);
        plan.setMealType("breakfast");
        plan.setFoodItems("oatmeal, berries");
        plan.setCalories(350);
        plan.setDayOfWeek("monday");
        return TestEntities.withId(plan, UUID.randomUUID());
    }

    @Test
    void doctorCreatedPlanRecordsAuthor() {
        when(dietPlanRepository.saveAndFlush(any(DietPlan.class))).thenAnswer(invocation -> invocation.getArgument(0));

        DietPlanResponse response = service.create(DOCTOR, PATIENT,
                new DietPlanRequest("lunch", "salmon, rice", 600, null, "tuesday"));

        verify(accessGuard).checkWrite(DOCTOR, PATIENT, ResourceCategory.DIET_PLANS);
        assertThat(response.createdBy()).isEqualTo(DOCTOR);
        assertThat(response.calories()).isEqualTo(600);
    }

    @Test
    void updateKeepsOptionalFieldsWhenOmitted() {
        DietPlan plan = existingPlan();
        when(dietPlanRepository.findById(plan.getId())).thenReturn(Optional.of(plan));
        when(dietPlanRepository.saveAndFlush(plan)).thenReturn(plan);

        DietPlanResponse response = service.update(PATIENT, plan.getId(),
                new DietPlanRequest("breakfast", "yogurt", null, null, null));

        assertThat(response.foodItems()).isEqualTo("yogurt");
        assertThat(response.calories()).isEqualTo(350);
        assertThat(response.dayOfWeek()).isEqualTo("monday");
    }

    @Test
    void revokedDoctorCannotUpdatePlan() {
        DietPlan plan = existingPlan();
        when(dietPlanRepository.findById(plan.getId())).thenReturn(Optional.of(plan));
        doThrow(new ProblemException(HttpStatus.FORBIDDEN, "NOT_AUTHORIZED"))
                .when(accessGuard).checkWrite(DOCTOR, PATIENT, ResourceCategory.DIET_PLANS);

        assertThatThrownBy(() -> service.update(DOCTOR, plan.getId(),
                new DietPlanRequest("dinner", "soup", null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("NOT_AUTHORIZED"));
        assertThat(plan.getMealType()).isEqualTo("breakfast");
        verify(dietPlanRepository, never()).saveAndFlush(any());
    }

    @Test
    void unknownPlanIsNotFoundBeforeAccessCheck() {
        UUID planId = UUID.randomUUID();
        when(dietPlanRepository.findById(planId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.delete(DOCTOR, planId))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo("DIET_PLAN_NOT_FOUND");
                });
        verifyNoInteractions(accessGuard);
    }

    @Test
    void noPlansIsEmptyList() {
        when(dietPlanRepository.findByPatientId(PATIENT)).thenReturn(List.of());

        assertThat(service.list(PATIENT, PATIENT)).isEmpty();
        verify(accessGuard).checkRead(PATIENT, PATIENT, ResourceCategory.DIET_PLANS);
    }
}

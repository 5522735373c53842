package com.hercare.backend.modules.consultation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.auth.infrastructure.persistence.HercareUserRepository;
import com.hercare.backend.modules.consultation.application.ConsultationService;
import com.hercare.backend.modules.consultation.domain.BillingItem;
import com.hercare.backend.modules.consultation.domain.Consultation;
import com.hercare.backend.modules.consultation.domain.PaymentStatus;
import com.hercare.backend.modules.consultation.infrastructure.persistence.ConsultationRepository;
import com.hercare.backend.modules.consultation.presentation.dto.ConsultationResponse;
import com.hercare.backend.modules.consultation.presentation.dto.CreateConsultationRequest;
import com.hercare.backend.modules.link.application.RecordAccessGuard;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConsultationServiceTest {

    private static final UUID DOCTOR = UUID.fromString("00000000-0000-0000-0000-0000000000d1");
    private static final UUID PATIENT = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    @Mock
    private ConsultationRepository consultationRepository;

    @Mock
    private HercareUserRepository userRepository;

    @Mock
    private RecordAccessGuard accessGuard;

    private ConsultationService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(OffsetDateTime.parse("2026-03-01T09:00:00Z").toInstant(), ZoneOffset.UTC);
        service = new ConsultationService(consultationRepository, userRepository, accessGuard, clock);
    }

    private static CreateConsultationRequest request(List<BillingItem> billing, BigDecimal total) {
        return new CreateConsultationRequest(null, "fever", "Flu", "rest", List.of(), billing, total, null, null);
    }

    @Test
    void billedConsultationStartsPendingWithSummedTotal() {
        when(consultationRepository.saveAndFlush(any(Consultation.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(userRepository.findById(DOCTOR))
                .thenReturn(Optional.of(TestEntities.user(DOCTOR, UserRole.DOCTOR, "doc@example.com")));

        ConsultationResponse response = service.create(DOCTOR, PATIENT, request(List.of(
                new BillingItem("visit", new BigDecimal("50.00")),
                new BillingItem("lab", new BigDecimal("25.50"))), null));

        verify(accessGuard).checkWrite(DOCTOR, PATIENT, ResourceCategory.CONSULTATIONS);
        assertThat(response.totalAmount()).isEqualByComparingTo("75.50");
        assertThat(response.paymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(response.doctorId()).isEqualTo(DOCTOR);
        assertThat(response.visitDate()).isEqualTo(LocalDate.of(2026, 3, 1));
    }

    @Test
    void freeConsultationIsSettled() {
        when(consultationRepository.saveAndFlush(any(Consultation.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(userRepository.findById(DOCTOR)).thenReturn(Optional.empty());

        ConsultationResponse response = service.create(DOCTOR, PATIENT, request(List.of(), BigDecimal.ZERO));

        assertThat(response.paymentStatus()).isEqualTo(PaymentStatus.PAID);
    }

    @Test
    void unknownConsultationCannotBePaid() {
        UUID id = UUID.randomUUID();
        when(consultationRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.markPaid(PATIENT, id))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("CONSULTATION_NOT_FOUND"));
    }
}

package com.hercare.backend.modules.link.application;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.global.common.code.AccessCodeGenerator;
import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.audit.application.AuditLogService;
import com.hercare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hercare.backend.modules.audit.domain.AuditAction;
import com.hercare.backend.modules.auth.application.IdentityService;
import com.hercare.backend.modules.auth.application.IdentityService.NewIdentity;
import com.hercare.backend.modules.auth.domain.HercareUser;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.auth.infrastructure.persistence.HercareUserRepository;
import com.hercare.backend.modules.link.domain.DoctorPatientLink;
import com.hercare.backend.modules.link.presentation.dto.RegisterPatientRequest;
import com.hercare.backend.modules.link.presentation.dto.RegisteredPatientResponse;
import com.hercare.backend.modules.link.presentation.dto.RegisteredPatientResponse.Outcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 의사가 환자를 대신 등록한다.
 *
 * <ul>
 *   <li>email of a registered user: link that user</li>
 *   <li>new email: create an account with a one-time temporary password</li>
 *   <li>no email: create a shadow patient and hand back a share code</li>
 * </ul>
 */
@Service
@Transactional
public class PatientRegistrationService {

    private static final Logger log = LoggerFactory.getLogger(PatientRegistrationService.class);
    private static final int TEMPORARY_PASSWORD_LENGTH = 12;

    private final IdentityService identityService;
    private final HercareUserRepository userRepository;
    private final LinkRegistryService linkRegistryService;
    private final AccessCodeGenerator codeGenerator;
    private final AuditLogService auditLogService;

    public PatientRegistrationService(
            IdentityService identityService,
            HercareUserRepository userRepository,
            LinkRegistryService linkRegistryService,
            AccessCodeGenerator codeGenerator,
            AuditLogService auditLogService
    ) {
        this.identityService = identityService;
        this.userRepository = userRepository;
        this.linkRegistryService = linkRegistryService;
        this.codeGenerator = codeGenerator;
        this.auditLogService = auditLogService;
    }

    public RegisteredPatientResponse registerPatient(UUID doctorId, RegisterPatientRequest request) {
        HercareUser doctor = identityService.getUser(doctorId);
        if (!doctor.hasRole(UserRole.DOCTOR)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ROLE_NOT_ALLOWED");
        }

        String email = request.email() == null || request.email().isBlank() ? null : request.email().trim();
        RegisteredPatientResponse response;
        if (email == null) {
            response = registerShadow(doctorId, request);
        } else {
            Optional<HercareUser> existing = userRepository.findByEmailIgnoreCase(email);
            response = existing.isPresent()
                    ? linkExisting(doctorId, existing.get())
                    : registerAccount(doctorId, request, email);
        }

        auditLogService.record(AuditLogCommand.success(
                AuditAction.PATIENT_REGISTERED, "USER", response.patientId(), doctorId,
                Map.of("outcome", response.outcome().name())));
        return response;
    }

    private RegisteredPatientResponse registerShadow(UUID doctorId, RegisterPatientRequest request) {
        HercareUser shadow = identityService.createShadowPatient(request.name(), request.age());
        String shareCode = linkRegistryService.nextShareCode();
        DoctorPatientLink link = linkRegistryService.createLink(doctorId, shadow.getId(), shareCode);
        log.info("Doctor {} registered shadow patient {}", doctorId, shadow.getId());
        return new RegisteredPatientResponse(Outcome.SHADOW_CREATED, shadow.getId(), link.getId(), shareCode, null);
    }

    private RegisteredPatientResponse registerAccount(UUID doctorId, RegisterPatientRequest request, String email) {
        String temporaryPassword = codeGenerator.generate(TEMPORARY_PASSWORD_LENGTH);
        HercareUser patient = identityService.create(new NewIdentity(
                request.name(), UserRole.PATIENT, email, temporaryPassword, request.age(), null));
        DoctorPatientLink link = linkRegistryService.createLink(doctorId, patient.getId(), null);
        log.info("Doctor {} registered patient account {}", doctorId, patient.getId());
        return new RegisteredPatientResponse(Outcome.ACCOUNT_CREATED, patient.getId(), link.getId(), null, temporaryPassword);
    }

    private RegisteredPatientResponse linkExisting(UUID doctorId, HercareUser patient) {
        if (!patient.hasRole(UserRole.PATIENT)) {
            throw new ProblemException(HttpStatus.CONFLICT, "DUPLICATE_IDENTITY");
        }
        DoctorPatientLink link = linkRegistryService.createLink(doctorId, patient.getId(), null);
        return new RegisteredPatientResponse(Outcome.EXISTING_LINKED, patient.getId(), link.getId(), null, null);
    }
}

package com.hercare.backend.modules.doctor.application;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.hercare.backend.global.common.code.AccessCodeGenerator;
import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.audit.application.AuditLogService;
import com.hercare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hercare.backend.modules.audit.domain.AuditAction;
import com.hercare.backend.modules.auth.application.IdentityService;
import com.hercare.backend.modules.auth.domain.HercareUser;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.doctor.domain.DoctorProfile;
import com.hercare.backend.modules.doctor.infrastructure.persistence.DoctorProfileRepository;
import com.hercare.backend.modules.doctor.presentation.dto.CreateDoctorProfileRequest;
import com.hercare.backend.modules.doctor.presentation.dto.DoctorProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class DoctorProfileService {

    private static final Logger log = LoggerFactory.getLogger(DoctorProfileService.class);
    private static final int MAX_CODE_ATTEMPTS = 10;

    private final DoctorProfileRepository doctorProfileRepository;
    private final IdentityService identityService;
    private final AccessCodeGenerator codeGenerator;
    private final AuditLogService auditLogService;
    private final int inviteCodeLength;

    public DoctorProfileService(
            DoctorProfileRepository doctorProfileRepository,
            IdentityService identityService,
            AccessCodeGenerator codeGenerator,
            AuditLogService auditLogService,
            @Value("${hercare.codes.invite-length:6}") int inviteCodeLength
    ) {
        this.doctorProfileRepository = doctorProfileRepository;
        this.identityService = identityService;
        this.codeGenerator = codeGenerator;
        this.auditLogService = auditLogService;
        this.inviteCodeLength = inviteCodeLength;
    }

    public DoctorProfileResponse createProfile(UUID doctorId, CreateDoctorProfileRequest request) {
        HercareUser doctor = identityService.getUser(doctorId);
        if (!doctor.hasRole(UserRole.DOCTOR)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ROLE_NOT_ALLOWED");
        }
        if (doctorProfileRepository.existsByUserId(doctorId)) {
            throw new ProblemException(HttpStatus.CONFLICT, "PROFILE_ALREADY_EXISTS");
        }

        DoctorProfile profile = new DoctorProfile();
        profile.setUserId(doctorId);
        profile.setSpecialization(request.specialization());
        profile.setHospital(request.hospital());
        profile.setExperienceYears(request.experienceYears());
        profile.setAvailable(true);
        profile.setInviteCode(nextInviteCode());

        DoctorProfile saved = doctorProfileRepository.saveAndFlush(profile);
        log.info("Doctor {} created profile {}", doctorId, saved.getId());
        auditLogService.record(AuditLogCommand.success(
                AuditAction.DOCTOR_PROFILE_CREATED, "DOCTOR_PROFILE", saved.getId(), doctorId, Map.of()));
        return DoctorProfileResponse.of(saved, doctor.getName(), true);
    }

    @Transactional(readOnly = true)
    public DoctorProfileResponse getProfile(UUID doctorId, UUID requesterId) {
        DoctorProfile profile = doctorProfileRepository.findByUserId(doctorId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "DOCTOR_PROFILE_NOT_FOUND"));
        HercareUser doctor = identityService.getUser(doctorId);
        return DoctorProfileResponse.of(profile, doctor.getName(), doctorId.equals(requesterId));
    }

    @Transactional(readOnly = true)
    public Optional<DoctorProfile> findByInviteCode(String inviteCode) {
        if (inviteCode == null || inviteCode.isBlank()) {
            return Optional.empty();
        }
        return doctorProfileRepository.findByInviteCode(inviteCode.trim().toUpperCase(Locale.ROOT));
    }

    private String nextInviteCode() {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String candidate = codeGenerator.generate(inviteCodeLength);
            if (!doctorProfileRepository.existsByInviteCode(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not allocate a unique invite code");
    }
}

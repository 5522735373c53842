package com.hercare.backend.modules.link.application;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.hercare.backend.global.common.code.AccessCodeGenerator;
import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.audit.application.AuditLogService;
import com.hercare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hercare.backend.modules.audit.domain.AuditAction;
import com.hercare.backend.modules.auth.domain.HercareUser;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.auth.infrastructure.persistence.HercareUserRepository;
import com.hercare.backend.modules.doctor.application.DoctorProfileService;
import com.hercare.backend.modules.doctor.domain.DoctorProfile;
import com.hercare.backend.modules.doctor.infrastructure.persistence.DoctorProfileRepository;
import com.hercare.backend.modules.link.domain.DoctorPatientLink;
import com.hercare.backend.modules.link.domain.LinkPermissions;
import com.hercare.backend.modules.link.domain.ResourceCategory;
import com.hercare.backend.modules.link.infrastructure.persistence.DoctorPatientLinkRepository;
import com.hercare.backend.modules.link.presentation.dto.LinkResponse;
import com.hercare.backend.modules.link.presentation.dto.LinkedDoctorResponse;
import com.hercare.backend.modules.link.presentation.dto.LinkedPatientResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class LinkRegistryService {

    private static final Logger log = LoggerFactory.getLogger(LinkRegistryService.class);
    private static final String PAIR_UNIQUE_CONSTRAINT = "uq_link_doctor_patient";
    private static final String RESOURCE_LINK = "DOCTOR_PATIENT_LINK";
    private static final int MAX_CODE_ATTEMPTS = 10;

    private final DoctorPatientLinkRepository linkRepository;
    private final HercareUserRepository userRepository;
    private final DoctorProfileRepository doctorProfileRepository;
    private final DoctorProfileService doctorProfileService;
    private final AccessCodeGenerator codeGenerator;
    private final AuditLogService auditLogService;
    private final int shareCodeLength;

    public LinkRegistryService(
            DoctorPatientLinkRepository linkRepository,
            HercareUserRepository userRepository,
            DoctorProfileRepository doctorProfileRepository,
            DoctorProfileService doctorProfileService,
            AccessCodeGenerator codeGenerator,
            AuditLogService auditLogService,
            @Value("${hercare.codes.share-length:8}") int shareCodeLength
    ) {
        this.linkRepository = linkRepository;
        this.userRepository = userRepository;
        this.doctorProfileRepository = doctorProfileRepository;
        this.doctorProfileService = doctorProfileService;
        this.codeGenerator = codeGenerator;
        this.auditLogService = auditLogService;
        this.shareCodeLength = shareCodeLength;
    }

    /**
     * Creates the link for a (doctor, patient) pair. The pair is unique in the database as well, so
     * a concurrent duplicate surfaces as the same {@code ALREADY_LINKED} failure.
     */
    public DoctorPatientLink createLink(UUID doctorId, UUID patientId, String shareCode) {
        HercareUser doctor = userRepository.findById(doctorId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "DOCTOR_NOT_FOUND"));
        HercareUser patient = userRepository.findById(patientId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PATIENT_NOT_FOUND"));
        if (!doctor.hasRole(UserRole.DOCTOR) || !patient.hasRole(UserRole.PATIENT)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_LINK_PARTIES");
        }
        if (linkRepository.existsByDoctorIdAndPatientId(doctorId, patientId)) {
            throw new ProblemException(HttpStatus.CONFLICT, "ALREADY_LINKED");
        }

        DoctorPatientLink saved;
        try {
            saved = linkRepository.saveAndFlush(new DoctorPatientLink(doctorId, patientId, shareCode));
        } catch (DataIntegrityViolationException ex) {
            if (violates(ex, PAIR_UNIQUE_CONSTRAINT)) {
                throw new ProblemException(HttpStatus.CONFLICT, "ALREADY_LINKED");
            }
            throw ex;
        }

        log.info("Linked doctor {} to patient {} (link {})", doctorId, patientId, saved.getId());
        auditLogService.record(AuditLogCommand.success(
                AuditAction.LINK_CREATED, RESOURCE_LINK, saved.getId(), doctorId,
                Map.of("patientId", patientId.toString(), "shadow", shareCode != null)));
        return saved;
    }

    /**
     * 환자가 의사의 초대 코드로 직접 연결한다.
     */
    public LinkResponse createLinkViaInvite(UUID patientId, String inviteCode) {
        DoctorProfile profile = doctorProfileService.findByInviteCode(inviteCode)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "INVALID_INVITE_CODE"));
        return LinkResponse.from(createLink(profile.getUserId(), patientId, null));
    }

    @Transactional(readOnly = true)
    public Optional<DoctorPatientLink> findLink(UUID doctorId, UUID patientId) {
        return linkRepository.findByDoctorIdAndPatientId(doctorId, patientId);
    }

    /**
     * Looks up a shadow link by its share code and row-locks it until the caller's transaction ends.
     * A second claimer blocks here and, once the first one has cleared the code, finds nothing.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<DoctorPatientLink> findByShareCodeForUpdate(String shareCode) {
        return linkRepository.findByShareCodeForUpdate(shareCode);
    }

    /**
     * Replaces the whole permission record of a link. Only the link's patient may do this.
     */
    public LinkResponse setPermissions(UUID linkId, UUID requesterId, Map<String, Boolean> permissions) {
        DoctorPatientLink link = linkRepository.findById(linkId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "LINK_NOT_FOUND"));
        if (!link.getPatientId().equals(requesterId)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "NOT_AUTHORIZED");
        }
        return applyPermissions(link, requesterId, permissions);
    }

    public LinkResponse setPermissionsForDoctor(UUID doctorId, UUID patientId, Map<String, Boolean> permissions) {
        DoctorPatientLink link = linkRepository.findByDoctorIdAndPatientId(doctorId, patientId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "LINK_NOT_FOUND"));
        return applyPermissions(link, patientId, permissions);
    }

    @Transactional(readOnly = true)
    public List<LinkedDoctorResponse> listMyDoctors(UUID patientId) {
        List<DoctorPatientLink> links = linkRepository.findByPatientId(patientId);
        List<UUID> doctorIds = links.stream().map(DoctorPatientLink::getDoctorId).toList();
        Map<UUID, HercareUser> doctors = usersById(doctorIds);
        Map<UUID, DoctorProfile> profiles = doctorProfileRepository.findByUserIds(doctorIds).stream()
                .collect(Collectors.toMap(DoctorProfile::getUserId, Function.identity()));

        return links.stream()
                .map(link -> {
                    HercareUser doctor = doctors.get(link.getDoctorId());
                    DoctorProfile profile = profiles.get(link.getDoctorId());
                    return new LinkedDoctorResponse(
                            link.getId(),
                            link.getDoctorId(),
                            doctor != null ? doctor.getName() : null,
                            profile != null ? profile.getSpecialization() : null,
                            profile != null ? profile.getHospital() : null,
                            link.getPermissions().effectiveByCode()
                    );
                })
                .toList();
    }

    @Transactional(readOnly = true)
    public List<LinkedPatientResponse> listMyPatients(UUID doctorId) {
        List<DoctorPatientLink> links = linkRepository.findByDoctorId(doctorId);
        Map<UUID, HercareUser> patients = usersById(links.stream().map(DoctorPatientLink::getPatientId).toList());

        return links.stream()
                .map(link -> {
                    HercareUser patient = patients.get(link.getPatientId());
                    return new LinkedPatientResponse(
                            link.getId(),
                            link.getPatientId(),
                            patient != null ? patient.getName() : null,
                            patient != null ? patient.getAge() : null,
                            patient != null && patient.isShadow(),
                            link.getShareCode(),
                            link.getPermissions().effectiveByCode()
                    );
                })
                .toList();
    }

    /**
     * Allocates a share code no other link currently holds.
     */
    @Transactional(readOnly = true)
    public String nextShareCode() {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            String candidate = codeGenerator.generate(shareCodeLength);
            if (!linkRepository.existsByShareCode(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not allocate a unique share code");
    }

    static LinkPermissions toPermissions(Map<String, Boolean> wire) {
        Map<ResourceCategory, Boolean> values = new EnumMap<>(ResourceCategory.class);
        wire.forEach((code, value) -> {
            ResourceCategory category = ResourceCategory.fromCode(code)
                    .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "UNKNOWN_RESOURCE_CATEGORY",
                            "unknown resource category: " + code));
            values.put(category, value);
        });
        return LinkPermissions.of(values);
    }

    private LinkResponse applyPermissions(DoctorPatientLink link, UUID patientId, Map<String, Boolean> permissions) {
        LinkPermissions replacement = toPermissions(permissions);
        link.replacePermissions(replacement);
        DoctorPatientLink saved = linkRepository.saveAndFlush(link);

        log.info("Patient {} updated permissions on link {}", patientId, saved.getId());
        auditLogService.record(AuditLogCommand.success(
                AuditAction.PERMISSIONS_UPDATED, RESOURCE_LINK, saved.getId(), patientId,
                Map.of("explicit", replacement.explicitValues().entrySet().stream()
                        .collect(Collectors.toMap(e -> e.getKey().getCode(), Map.Entry::getValue)))));
        return LinkResponse.from(saved);
    }

    private Map<UUID, HercareUser> usersById(List<UUID> ids) {
        if (ids.isEmpty()) {
            return Map.of();
        }
        return userRepository.findByIds(ids).stream()
                .collect(Collectors.toMap(HercareUser::getId, Function.identity()));
    }

    private static boolean violates(DataIntegrityViolationException ex, String constraint) {
        String message = NestedExceptionUtils.getMostSpecificCause(ex).getMessage();
        return message != null && message.contains(constraint);
    }
}

package com.hercare.backend.modules.auth.application;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.audit.application.AuditLogService;
import com.hercare.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.hercare.backend.modules.audit.domain.AuditAction;
import com.hercare.backend.modules.audit.domain.AuditStatus;
import com.hercare.backend.modules.auth.application.IdentityService.NewIdentity;
import com.hercare.backend.modules.auth.domain.HercareUser;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.auth.infrastructure.persistence.HercareUserRepository;
import com.hercare.backend.modules.auth.presentation.dto.AccessTokenResponse;
import com.hercare.backend.modules.auth.presentation.dto.LoginRequest;
import com.hercare.backend.modules.auth.presentation.dto.LoginResponse;
import com.hercare.backend.modules.auth.presentation.dto.RegisterRequest;
import com.hercare.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.hercare.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private static final String RESOURCE_USER = "USER";

    private final HercareUserRepository userRepository;
    private final IdentityService identityService;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final AuditLogService auditLogService;

    public AuthService(
            HercareUserRepository userRepository,
            IdentityService identityService,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            AuditLogService auditLogService
    ) {
        this.userRepository = userRepository;
        this.identityService = identityService;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.auditLogService = auditLogService;
    }

    /**
     * 셀프 가입. Only patients and doctors may sign themselves up.
     */
    @Transactional
    public LoginResponse register(RegisterRequest request) {
        if (request.role() != UserRole.PATIENT && request.role() != UserRole.DOCTOR) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "ROLE_NOT_ALLOWED",
                    "self-registration is limited to PATIENT and DOCTOR");
        }
        HercareUser user = identityService.create(new NewIdentity(
                request.name(),
                request.role(),
                request.email(),
                request.password(),
                request.age(),
                request.phone()
        ));
        auditLogService.record(AuditLogCommand.success(
                AuditAction.REGISTER, RESOURCE_USER, user.getId(), user.getId(), Map.of("role", user.getRole().name())));
        return issueFor(user);
    }

    public LoginResponse login(LoginRequest request) {
        HercareUser user = userRepository.findByEmailIgnoreCase(request.email().trim())
                .orElse(null);

        if (user == null || user.getPasswordHash() == null
                || !passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            auditLogService.record(new AuditLogCommand(
                    AuditAction.LOGIN,
                    RESOURCE_USER,
                    user != null ? user.getId().toString() : "unknown",
                    user != null ? user.getId() : null,
                    AuditStatus.FAILED,
                    Map.of("reason", "INVALID_CREDENTIALS")
            ));
            log.warn("Login failed for {}", user != null ? user.getId() : "unknown email");
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }

        auditLogService.record(AuditLogCommand.success(AuditAction.LOGIN, RESOURCE_USER, user.getId(), user.getId(), null));
        return issueFor(user);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        return UserProfileResponse.from(identityService.getUser(userId));
    }

    @Transactional
    public UserProfileResponse updateProfile(UUID userId, UpdateProfileRequest request) {
        HercareUser user = identityService.getUser(userId);
        if (request.name() != null) {
            user.setName(request.name().trim());
        }
        if (request.age() != null) {
            user.setAge(request.age());
        }
        if (request.phone() != null) {
            user.setPhone(request.phone());
        }
        return UserProfileResponse.from(userRepository.saveAndFlush(user));
    }

    private LoginResponse issueFor(HercareUser user) {
        List<String> roles = List.of(user.getRole().name());
        AccessTokenResponse tokens = jwtTokenService.issueAccessToken(user.getId(), user.getEmail(), roles);
        return new LoginResponse(tokens, UserProfileResponse.from(user));
    }
}

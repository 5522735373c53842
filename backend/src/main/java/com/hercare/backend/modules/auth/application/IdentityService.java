package com.hercare.backend.modules.auth.application;

import java.util.Locale;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.auth.domain.HercareUser;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.auth.infrastructure.persistence.HercareUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 사용자 생성/조회. Users are removed only when a shadow identity is claimed.
 */
@Service
@Transactional
public class IdentityService {

    private static final Logger log = LoggerFactory.getLogger(IdentityService.class);
    private static final String EMAIL_UNIQUE_CONSTRAINT = "uq_users_email";

    private final HercareUserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    public IdentityService(HercareUserRepository userRepository, PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Creates a user. Passing neither email nor password creates a shadow identity.
     */
    public HercareUser create(NewIdentity identity) {
        String email = normalizeEmail(identity.email());
        String rawPassword = identity.rawPassword();
        boolean hasPassword = rawPassword != null && !rawPassword.isBlank();
        boolean hasEmail = email != null;
        if (hasEmail != hasPassword) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INCOMPLETE_CREDENTIALS",
                    "email and password must be supplied together");
        }
        if (email != null && userRepository.existsByEmailIgnoreCase(email)) {
            throw new ProblemException(HttpStatus.CONFLICT, "DUPLICATE_IDENTITY");
        }

        HercareUser user = new HercareUser();
        user.setName(identity.name().trim());
        user.setRole(identity.role());
        user.setEmail(email);
        user.setPasswordHash(hasPassword ? passwordEncoder.encode(rawPassword) : null);
        user.setAge(identity.age());
        user.setPhone(identity.phone());

        try {
            HercareUser saved = userRepository.saveAndFlush(user);
            log.info("Created {} user {}{}", saved.getRole(), saved.getId(), saved.isShadow() ? " (shadow)" : "");
            return saved;
        } catch (DataIntegrityViolationException ex) {
            if (isEmailConflict(ex)) {
                throw new ProblemException(HttpStatus.CONFLICT, "DUPLICATE_IDENTITY");
            }
            throw ex;
        }
    }

    public HercareUser createShadowPatient(String name, Integer age) {
        return create(new NewIdentity(name, UserRole.PATIENT, null, null, age, null));
    }

    @Transactional(readOnly = true)
    public HercareUser getUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
    }

    /**
     * Removes a shadow identity. Registered accounts are never deleted here.
     */
    public void deleteShadow(HercareUser user) {
        if (!user.isShadow()) {
            throw new IllegalStateException("Refusing to delete registered user " + user.getId());
        }
        userRepository.delete(user);
        userRepository.flush();
    }

    static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private boolean isEmailConflict(DataIntegrityViolationException ex) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = cause.getMessage();
        return message != null && message.contains(EMAIL_UNIQUE_CONSTRAINT);
    }

    public record NewIdentity(String name, UserRole role, String email, String rawPassword, Integer age, String phone) {
    }
}

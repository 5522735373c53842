package com.hercare.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.util.UUID;

import com.hercare.backend.global.error.ProblemException;
import com.hercare.backend.modules.auth.application.IdentityService;
import com.hercare.backend.modules.auth.application.IdentityService.NewIdentity;
import com.hercare.backend.modules.auth.domain.HercareUser;
import com.hercare.backend.modules.auth.domain.UserRole;
import com.hercare.backend.modules.auth.infrastructure.persistence.HercareUserRepository;
import com.hercare.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

@ExtendWith(MockitoExtension.class)
class IdentityServiceTest {

    @Mock
    private HercareUserRepository userRepository;

    private IdentityService identityService;

    @BeforeEach
    void setUp() {
        identityService = new IdentityService(userRepository, new BCryptPasswordEncoder(4));
    }

    @Test
    void shadowPatientHasNoCredentials() {
        when(userRepository.saveAndFlush(any(HercareUser.class))).thenAnswer(invocation -> invocation.getArgument(0));

        HercareUser shadow = identityService.createShadowPatient("  Jane ", 29);

        assertThat(shadow.isShadow()).isTrue();
        assertThat(shadow.getName()).isEqualTo("Jane");
        assertThat(shadow.getRole()).isEqualTo(UserRole.PATIENT);
        verify(userRepository, never()).existsByEmailIgnoreCase(any());
    }

    @Test
    void emailIsNormalizedAndPasswordHashed() {
        when(userRepository.existsByEmailIgnoreCase("jane@example.com")).thenReturn(false);
        when(userRepository.saveAndFlush(any(HercareUser.class))).thenAnswer(invocation -> invocation.getArgument(0));

        HercareUser user = identityService.create(
                new NewIdentity("Jane", UserRole.PATIENT, " Jane@Example.COM ", "secret-pass", null, null));

        assertThat(user.getEmail()).isEqualTo("jane@example.com");
        assertThat(user.getPasswordHash()).isNotEqualTo("secret-pass").startsWith("$2");
        assertThat(user.isShadow()).isFalse();
    }

    @Test
    void registeredEmailIsDuplicate() {
        when(userRepository.existsByEmailIgnoreCase("jane@example.com")).thenReturn(true);

        assertThatThrownBy(() -> identityService.create(
                new NewIdentity("Jane", UserRole.PATIENT, "jane@example.com", "secret-pass", null, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("DUPLICATE_IDENTITY");
                });
    }

    @Test
    void uniqueIndexViolationIsDuplicate() {
        when(userRepository.existsByEmailIgnoreCase("jane@example.com")).thenReturn(false);
        when(userRepository.saveAndFlush(any(HercareUser.class))).thenThrow(new DataIntegrityViolationException(
                "insert failed", new SQLException("duplicate key value violates unique constraint \"uq_users_email\"")));

        assertThatThrownBy(() -> identityService.create(
                new NewIdentity("Jane", UserRole.PATIENT, "jane@example.com", "secret-pass", null, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("DUPLICATE_IDENTITY"));
    }

    @Test
    void emailWithoutPasswordIsIncomplete() {
        assertThatThrownBy(() -> identityService.create(
                new NewIdentity("Jane", UserRole.PATIENT, "jane@example.com", null, null, null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                    assertThat(ex.getCode()).isEqualTo("INCOMPLETE_CREDENTIALS");
                });
    }

    @Test
    void registeredUsersAreNeverDeletedAsShadow() {
        HercareUser registered = TestEntities.user(UUID.randomUUID(), UserRole.PATIENT, "jane@example.com");

        assertThatThrownBy(() -> identityService.deleteShadow(registered)).isInstanceOf(IllegalStateException.class);
        verify(userRepository, never()).delete(any());
    }
}

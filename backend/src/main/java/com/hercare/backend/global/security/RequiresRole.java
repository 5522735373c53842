package com.hercare.backend.global.security;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.hercare.backend.modules.auth.domain.UserRole;

/**
 * Declares which roles may invoke a controller method.
 *
 * <p>Checked by {@link RoleRequirementInterceptor} before the handler runs. The check looks only
 * at the authenticated principal; record-level access is decided later against the patient link.</p>
 *
 * <pre>{@code
 * @RequiresRole(UserRole.DOCTOR)
 * @PostMapping("/doctor/patients")
 * public ResponseEntity<RegisteredPatientResponse> registerPatient(...) { ... }
 * }</pre>
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequiresRole {

    /**
     * Roles allowed to call the endpoint. The principal needs at least one of them.
     */
    UserRole[] value();
}

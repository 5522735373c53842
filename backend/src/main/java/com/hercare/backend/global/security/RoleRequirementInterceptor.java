package com.hercare.backend.global.security;

import java.util.Arrays;

import com.hercare.backend.global.error.ProblemException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces {@link RequiresRole} on handler methods (method-level annotation wins over the type-level one).
 */
@Component
public class RoleRequirementInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RoleRequirementInterceptor.class);

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        RequiresRole requirement = handlerMethod.getMethodAnnotation(RequiresRole.class);
        if (requirement == null) {
            requirement = handlerMethod.getBeanType().getAnnotation(RequiresRole.class);
        }
        if (requirement == null) {
            return true;
        }

        JwtAuthenticationPrincipal principal = SecurityUtils.getCurrentPrincipal();
        boolean allowed = Arrays.stream(requirement.value())
                .anyMatch(role -> principal.hasRole(role.name()));
        if (!allowed) {
            log.warn("Role check failed for user {} on {} {} (required {})",
                    principal.userId(), request.getMethod(), request.getRequestURI(), Arrays.toString(requirement.value()));
            throw new ProblemException(HttpStatus.FORBIDDEN, "ROLE_NOT_ALLOWED");
        }
        return true;
    }
}

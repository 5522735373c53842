package com.hercare.backend.modules.link.application;

import java.util.Objects;
import java.util.UUID;

import com.hercare.backend.modules.link.domain.AccessDecision;
import com.hercare.backend.modules.link.domain.DoctorPatientLink;
import com.hercare.backend.modules.link.domain.ResourceCategory;

import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Decides whether a requester may touch a patient's records of one category.
 *
 * <p>Pure function over its arguments: the caller loads the current link row and passes it in.
 * Rules, first match wins:</p>
 * <ol>
 *   <li>requester is the owner: {@link AccessDecision#OWNER}</li>
 *   <li>no link between requester (doctor) and owner (patient): {@link AccessDecision#NOT_LINKED}</li>
 *   <li>flag explicitly {@code false}: {@link AccessDecision#REVOKED}</li>
 *   <li>flag {@code true} or unset: {@link AccessDecision#PERMITTED}</li>
 * </ol>
 */
@Component
public class PermissionEvaluator {

    public AccessDecision evaluate(UUID requesterId, UUID ownerId, ResourceCategory category,
                                   @Nullable DoctorPatientLink link) {
        Objects.requireNonNull(requesterId, "requesterId");
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(category, "category");

        if (requesterId.equals(ownerId)) {
            return AccessDecision.OWNER;
        }
        if (link == null || !link.connects(requesterId, ownerId)) {
            return AccessDecision.NOT_LINKED;
        }
        return link.getPermissions().isAllowed(category) ? AccessDecision.PERMITTED : AccessDecision.REVOKED;
    }

    public boolean canAccess(UUID requesterId, UUID ownerId, ResourceCategory category,
                             @Nullable DoctorPatientLink link) {
        return evaluate(requesterId, ownerId, category, link).isAllowed();
    }
}

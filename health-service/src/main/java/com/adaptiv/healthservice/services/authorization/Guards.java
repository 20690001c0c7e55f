package com.adaptiv.healthservice.services.authorization;

import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.models.Role;
import com.adaptiv.healthservice.models.ShareState;
import com.adaptiv.healthservice.services.consent.ConsentEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Building blocks for access rules.
 */
@Component
@RequiredArgsConstructor
public class Guards {

    private final ConsentEngine consentEngine;

    public Guard anyAuthenticated() {
        return request -> request.getActor().isActive()
                ? AccessDecision.permit()
                : AccessDecision.deny(ErrorCode.ACCOUNT_INACTIVE);
    }

    public Guard requireAdmin() {
        return hasRole(Role.ADMIN);
    }

    public Guard requirePatient() {
        return hasRole(Role.PATIENT);
    }

    /**
     * Admins are refused with their own code so callers can tell exclusion from a plain role mismatch.
     */
    public Guard excludeAdmin() {
        return request -> request.getActor().getRole() == Role.ADMIN
                ? AccessDecision.deny(ErrorCode.FORBIDDEN_ADMIN_EXCLUDED)
                : AccessDecision.permit();
    }

    public Guard requireClinician() {
        return excludeAdmin().and(hasRole(Role.CLINICIAN));
    }

    /**
     * Target must be a known patient whose sharing state still allows clinician access.
     */
    public Guard consentGranted() {
        return request -> {
            if (request.getTargetId() == null) {
                return AccessDecision.deny(ErrorCode.NOT_FOUND, "Patient not found");
            }
            Optional<ShareState> state = consentEngine.sharingState(request.getTargetId());
            if (state.isEmpty()) {
                return AccessDecision.deny(ErrorCode.NOT_FOUND, "Patient not found");
            }
            return state.get().permitsClinicianAccess()
                    ? AccessDecision.permit()
                    : AccessDecision.deny(ErrorCode.FORBIDDEN_CONSENT);
        };
    }

    /**
     * Permits an actor reading their own data; everyone else must pass {@code otherwise}.
     */
    public Guard selfOr(Guard otherwise) {
        return request -> request.isSelfAccess() ? AccessDecision.permit() : otherwise.evaluate(request);
    }

    private Guard hasRole(Role role) {
        return request -> request.getActor().getRole() == role
                ? AccessDecision.permit()
                : AccessDecision.deny(ErrorCode.FORBIDDEN_ROLE);
    }
}

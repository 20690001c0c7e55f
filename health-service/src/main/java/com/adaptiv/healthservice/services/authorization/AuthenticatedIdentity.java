package com.adaptiv.healthservice.services.authorization;

import com.adaptiv.healthservice.models.Role;
import lombok.Value;

import java.util.UUID;

/**
 * Principal derived from a validated access token. Role is what the token claims;
 * guards re-check it against the stored account.
 */
@Value
public class AuthenticatedIdentity {
    UUID accountId;
    Role role;
}

package com.adaptiv.healthservice.services.authorization;

import com.adaptiv.healthservice.models.Account;
import lombok.Value;

import java.util.UUID;

@Value
public class AccessRequest {
    Account actor;
    UUID targetId;
    String operation;

    public boolean isSelfAccess() {
        return targetId != null && targetId.equals(actor.getAccountId());
    }
}

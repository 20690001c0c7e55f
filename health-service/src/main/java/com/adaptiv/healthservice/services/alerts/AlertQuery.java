package com.adaptiv.healthservice.services.alerts;

import com.adaptiv.healthservice.models.Severity;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AlertQuery {
    @Builder.Default
    int page = 1;
    @Builder.Default
    int perPage = 20;
    Boolean acknowledged;
    Severity severity;
    // Superseded and resolved alerts are hidden unless asked for.
    boolean includeInactive;
}

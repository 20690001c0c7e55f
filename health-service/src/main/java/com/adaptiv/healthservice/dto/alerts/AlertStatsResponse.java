package com.adaptiv.healthservice.dto.alerts;

import com.adaptiv.healthservice.models.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertStatsResponse {
    private int days;
    private long total;
    private long unacknowledged;
    private Map<Severity, Long> bySeverity;
}

package com.adaptiv.healthservice.dto.alerts;

import com.adaptiv.healthservice.models.AlertRecord;
import com.adaptiv.healthservice.models.AlertType;
import com.adaptiv.healthservice.models.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertResponse {
    private Long alertId;
    private UUID subjectId;
    private AlertType alertType;
    private Severity severity;
    private String title;
    private String message;
    private String actionRequired;
    private Double triggerValue;
    private Double thresholdValue;
    private LocalDateTime createdAt;
    private boolean acknowledged;
    private boolean superseded;
    private LocalDateTime resolvedAt;
    private UUID resolvedBy;
    private String resolutionNotes;

    public static AlertResponse from(AlertRecord alert) {
        return AlertResponse.builder()
                .alertId(alert.getAlertId())
                .subjectId(alert.getSubjectId())
                .alertType(alert.getAlertType())
                .severity(alert.getSeverity())
                .title(alert.getTitle())
                .message(alert.getMessage())
                .actionRequired(alert.getActionRequired())
                .triggerValue(alert.getTriggerValue())
                .thresholdValue(alert.getThresholdValue())
                .createdAt(alert.getCreatedAt())
                .acknowledged(alert.isAcknowledged())
                .superseded(alert.isSuperseded())
                .resolvedAt(alert.getResolvedAt())
                .resolvedBy(alert.getResolvedBy())
                .resolutionNotes(alert.getResolutionNotes())
                .build();
    }
}

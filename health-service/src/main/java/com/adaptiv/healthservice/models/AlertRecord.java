package com.adaptiv.healthservice.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Generated alert. Only the acknowledgement, resolution and superseded fields change after insert.
 */
@Entity
@Table(name = "alerts", indexes = @Index(name = "idx_alert_subject_type_time", columnList = "subject_id, alert_type, created_at"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long alertId;

    @Column(name = "subject_id", nullable = false)
    private UUID subjectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, length = 32)
    private AlertType alertType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Severity severity;

    @Column(nullable = false, length = 120)
    private String title;

    @Column(length = 1000)
    private String message;

    @Column(length = 255)
    private String actionRequired;

    private Double triggerValue;

    private Double thresholdValue;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Builder.Default
    @Column(nullable = false)
    private boolean acknowledged = false;

    @Builder.Default
    @Column(nullable = false)
    private boolean superseded = false;

    private LocalDateTime resolvedAt;

    private UUID resolvedBy;

    @Column(length = 1000)
    private String resolutionNotes;

    public boolean isActive() {
        return !superseded && resolvedAt == null;
    }
}

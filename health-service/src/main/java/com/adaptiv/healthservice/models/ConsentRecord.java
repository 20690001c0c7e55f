package com.adaptiv.healthservice.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Data-sharing state of a single patient. Exists only for patient accounts.
 */
@Entity
@Table(name = "consent_records")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConsentRecord {

    @Id
    @Column(name = "patient_id", updatable = false, nullable = false)
    private UUID patientId;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    private ShareState shareState = ShareState.ON;

    private LocalDateTime requestedAt;

    private UUID requestedBy;

    private LocalDateTime reviewedAt;

    private UUID reviewedBy;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private ConsentDecision decision;

    @Column(length = 500)
    private String reason;

    private LocalDateTime updatedAt;
}

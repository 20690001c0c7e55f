package com.adaptiv.healthservice.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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

@Entity
@Table(name = "vital_signs", indexes = @Index(name = "idx_vital_subject_time", columnList = "subject_id, recorded_at"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VitalSignRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long readingId;

    @Column(name = "subject_id", nullable = false)
    private UUID subjectId;

    @Column(nullable = false)
    private Integer heartRate;

    private Double spo2;

    private Integer systolicBp;

    private Integer diastolicBp;

    private Double hrv;

    @Column(length = 64)
    private String sourceDevice;

    @Column(length = 128)
    private String deviceId;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}

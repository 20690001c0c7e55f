package com.adaptiv.healthservice.models;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Password hash and brute-force counters, one row per account.
 * The counter is only ever moved by compare-and-set updates in {@code CredentialRepository}.
 */
@Entity
@Table(name = "credentials")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Credential {

    @Id
    @Column(name = "account_id", updatable = false, nullable = false)
    private UUID accountId;

    @Column(nullable = false, length = 256)
    private String passwordHash;

    @Builder.Default
    @Column(nullable = false)
    private int failedAttempts = 0;

    private LocalDateTime lockoutExpiresAt;

    private LocalDateTime passwordChangedAt;

    public boolean isLockedAt(LocalDateTime now) {
        return lockoutExpiresAt != null && lockoutExpiresAt.isAfter(now);
    }
}

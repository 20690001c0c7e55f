package com.adaptiv.healthservice.dto.consent;

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
public class PendingConsentResponse {
    private UUID patientId;
    private String email;
    private String fullName;
    private LocalDateTime requestedAt;
    private String reason;
}

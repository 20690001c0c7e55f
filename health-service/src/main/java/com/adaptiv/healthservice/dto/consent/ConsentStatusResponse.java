package com.adaptiv.healthservice.dto.consent;

import com.adaptiv.healthservice.models.ConsentDecision;
import com.adaptiv.healthservice.models.ConsentRecord;
import com.adaptiv.healthservice.models.ShareState;
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
public class ConsentStatusResponse {
    private UUID patientId;
    private ShareState shareState;
    private LocalDateTime requestedAt;
    private UUID requestedBy;
    private LocalDateTime reviewedAt;
    private UUID reviewedBy;
    private ConsentDecision decision;
    private String reason;

    public static ConsentStatusResponse from(ConsentRecord record) {
        return ConsentStatusResponse.builder()
                .patientId(record.getPatientId())
                .shareState(record.getShareState())
                .requestedAt(record.getRequestedAt())
                .requestedBy(record.getRequestedBy())
                .reviewedAt(record.getReviewedAt())
                .reviewedBy(record.getReviewedBy())
                .decision(record.getDecision())
                .reason(record.getReason())
                .build();
    }
}

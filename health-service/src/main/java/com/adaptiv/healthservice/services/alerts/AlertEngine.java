package com.adaptiv.healthservice.services.alerts;

import com.adaptiv.healthservice.models.AlertRecord;
import com.adaptiv.healthservice.models.AlertType;
import com.adaptiv.healthservice.models.Severity;
import com.adaptiv.healthservice.models.VitalSignRecord;
import com.adaptiv.healthservice.repository.AlertRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns readings into alerts. Runs inside the caller's write transaction, so a
 * failure here rolls back the reading that triggered it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertEngine {

    public static final Duration DEDUP_WINDOW = Duration.ofMinutes(5);

    private final AlertRecordRepository alertRepository;
    private final Clock clock;

    /**
     * Checks every threshold and persists all resulting alerts as one batch.
     * Active alerts of the same subject and type from the last five minutes are
     * superseded, leaving the newest as the single active one.
     */
    @Transactional
    public List<AlertRecord> evaluate(UUID subjectId, VitalSignRecord reading) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<AlertRecord> alerts = new ArrayList<>();

        for (VitalThreshold threshold : VitalThreshold.values()) {
            Optional<Double> breach = threshold.breach(reading);
            if (breach.isEmpty()) {
                continue;
            }
            double measured = breach.get();
            alerts.add(AlertRecord.builder()
                    .subjectId(subjectId)
                    .alertType(threshold.getAlertType())
                    .severity(threshold.getSeverity())
                    .title(threshold.getTitle())
                    .message(threshold.describe(measured))
                    .actionRequired(threshold.getActionRequired())
                    .triggerValue(measured)
                    .thresholdValue(threshold.getLimit())
                    .createdAt(now)
                    .build());
        }

        if (alerts.isEmpty()) {
            return alerts;
        }

        for (AlertRecord alert : alerts) {
            int superseded = alertRepository.supersedeRecent(subjectId, alert.getAlertType(), now.minus(DEDUP_WINDOW));
            if (superseded > 0) {
                log.debug("Superseded {} recent {} alert(s) for subject {}", superseded, alert.getAlertType(), subjectId);
            }
        }

        List<AlertRecord> saved = alertRepository.saveAll(alerts);
        log.warn("Raised {} alert(s) for subject {}: {}", saved.size(), subjectId,
                saved.stream().map(AlertRecord::getAlertType).toList());
        return saved;
    }

    /**
     * Warning raised when a patient asks to stop sharing data, for a clinician to review.
     */
    @Transactional
    public AlertRecord raiseConsentDisableRequest(UUID patientId, String reason) {
        String message = "Patient has requested to disable data sharing.";
        if (reason != null && !reason.isBlank()) {
            message = message + " Reason: " + reason;
        }

        AlertRecord alert = AlertRecord.builder()
                .subjectId(patientId)
                .alertType(AlertType.CONSENT_DISABLE_REQUEST)
                .severity(Severity.WARNING)
                .title("Patient Opt-Out Request")
                .message(message)
                .actionRequired("Review and approve/reject this consent request.")
                .createdAt(LocalDateTime.now(clock))
                .build();
        return alertRepository.save(alert);
    }
}

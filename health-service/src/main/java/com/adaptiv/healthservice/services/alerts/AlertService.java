package com.adaptiv.healthservice.services.alerts;

import com.adaptiv.healthservice.dto.PageResponse;
import com.adaptiv.healthservice.dto.alerts.AlertResponse;
import com.adaptiv.healthservice.dto.alerts.AlertStatsResponse;
import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.AlertRecord;
import com.adaptiv.healthservice.models.Severity;
import com.adaptiv.healthservice.models.ShareState;
import com.adaptiv.healthservice.repository.AlertRecordRepository;
import com.adaptiv.healthservice.services.authorization.AuthenticatedIdentity;
import com.adaptiv.healthservice.services.authorization.Authorizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AlertService {

    public static final int MAX_PAGE_SIZE = 100;
    public static final int MAX_STATS_DAYS = 365;

    private final AlertRecordRepository alertRepository;
    private final Authorizer authorizer;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Outcome<PageResponse<AlertResponse>> listOwn(AuthenticatedIdentity identity, AlertQuery query) {
        Outcome<Account> actor = authorizer.authorizeOwnClinicalData(identity, "alerts.list");
        if (actor.isFailure()) {
            return actor.propagate();
        }
        return Outcome.success(search(actor.getValue().getAccountId(), query));
    }

    @Transactional(readOnly = true)
    public Outcome<PageResponse<AlertResponse>> listForPatient(AuthenticatedIdentity identity, UUID patientId,
                                                               AlertQuery query) {
        Outcome<Account> actor = authorizer.authorizeClinicianFor(identity, patientId, "alerts.list_patient");
        if (actor.isFailure()) {
            return actor.propagate();
        }
        return Outcome.success(search(patientId, query));
    }

    /**
     * The alert's subject may acknowledge it, as may a clinician with access to the subject.
     */
    @Transactional
    public Outcome<AlertResponse> acknowledge(AuthenticatedIdentity identity, Long alertId) {
        Outcome<Account> caller = authorizer.authorizeOwnClinicalData(identity, "alerts.acknowledge");
        if (caller.isFailure()) {
            return caller.propagate();
        }

        Optional<AlertRecord> alert = alertRepository.findById(alertId);
        if (alert.isEmpty()) {
            return Outcome.failure(ErrorCode.NOT_FOUND, "Alert not found");
        }

        Outcome<Account> access = authorizer.authorizePhiAccess(identity, alert.get().getSubjectId(), "alerts.acknowledge");
        if (access.isFailure()) {
            return access.propagate();
        }

        alert.get().setAcknowledged(true);
        log.info("Alert {} acknowledged by {}", alertId, identity.getAccountId());
        return Outcome.success(AlertResponse.from(alertRepository.save(alert.get())));
    }

    @Transactional
    public Outcome<AlertResponse> resolve(AuthenticatedIdentity identity, Long alertId, String resolutionNotes) {
        Outcome<Account> caller = authorizer.authorizeClinician(identity, "alerts.resolve");
        if (caller.isFailure()) {
            return caller.propagate();
        }

        Optional<AlertRecord> alert = alertRepository.findById(alertId);
        if (alert.isEmpty()) {
            return Outcome.failure(ErrorCode.NOT_FOUND, "Alert not found");
        }

        Outcome<Account> access = authorizer.authorizeClinicianFor(identity, alert.get().getSubjectId(), "alerts.resolve");
        if (access.isFailure()) {
            return access.propagate();
        }

        AlertRecord record = alert.get();
        record.setAcknowledged(true);
        record.setResolvedAt(LocalDateTime.now(clock));
        record.setResolvedBy(identity.getAccountId());
        record.setResolutionNotes(resolutionNotes);
        log.info("Alert {} resolved by {}", alertId, identity.getAccountId());
        return Outcome.success(AlertResponse.from(alertRepository.save(record)));
    }

    /**
     * Severity breakdown over the last {@code days} days, limited to patients who still share data.
     */
    @Transactional(readOnly = true)
    public Outcome<AlertStatsResponse> stats(AuthenticatedIdentity identity, int days) {
        Outcome<Account> caller = authorizer.authorizeClinician(identity, "alerts.stats");
        if (caller.isFailure()) {
            return caller.propagate();
        }
        if (days < 1 || days > MAX_STATS_DAYS) {
            return Outcome.failure(ErrorCode.VALIDATION_FAILED, "days must be between 1 and " + MAX_STATS_DAYS);
        }

        LocalDateTime since = LocalDateTime.now(clock).minusDays(days);
        Map<Severity, Long> bySeverity = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0L);
        }
        long total = 0;
        for (Object[] row : alertRepository.countBySeveritySince(since, ShareState.OFF)) {
            long count = ((Number) row[1]).longValue();
            bySeverity.put((Severity) row[0], count);
            total += count;
        }

        return Outcome.success(AlertStatsResponse.builder()
                .days(days)
                .total(total)
                .unacknowledged(alertRepository.countUnacknowledgedSince(since, ShareState.OFF))
                .bySeverity(bySeverity)
                .build());
    }

    private PageResponse<AlertResponse> search(UUID subjectId, AlertQuery query) {
        PageRequest pageable = PageRequest.of(Math.max(query.getPage(), 1) - 1,
                Math.min(Math.max(query.getPerPage(), 1), MAX_PAGE_SIZE));
        return PageResponse.from(alertRepository.search(subjectId, query.isIncludeInactive(), query.getAcknowledged(),
                query.getSeverity(), pageable), AlertResponse::from);
    }
}

package com.adaptiv.healthservice.services.vitals;

import com.adaptiv.healthservice.dto.PageResponse;
import com.adaptiv.healthservice.dto.vitals.BatchSubmissionResponse;
import com.adaptiv.healthservice.dto.vitals.VitalSignBatchRequest;
import com.adaptiv.healthservice.dto.vitals.VitalSignRequest;
import com.adaptiv.healthservice.dto.vitals.VitalSignResponse;
import com.adaptiv.healthservice.dto.vitals.VitalSubmissionResponse;
import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.AlertRecord;
import com.adaptiv.healthservice.models.VitalSignRecord;
import com.adaptiv.healthservice.repository.AccountRepository;
import com.adaptiv.healthservice.repository.VitalSignRepository;
import com.adaptiv.healthservice.services.alerts.AlertEngine;
import com.adaptiv.healthservice.services.authorization.AuthenticatedIdentity;
import com.adaptiv.healthservice.services.authorization.Authorizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Vital-sign ingestion and retrieval. Alert evaluation is part of every write:
 * a reading is never stored without its alerts, and vice versa.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VitalSignService {

    public static final int MAX_PAGE_SIZE = 100;

    private final VitalSignRepository vitalSignRepository;
    private final AccountRepository accountRepository;
    private final AlertEngine alertEngine;
    private final Authorizer authorizer;
    private final Clock clock;

    @Transactional
    public Outcome<VitalSubmissionResponse> submit(AuthenticatedIdentity identity, VitalSignRequest request) {
        Outcome<Account> actor = authorizer.authorizeOwnClinicalData(identity, "vitals.submit");
        if (actor.isFailure()) {
            return actor.propagate();
        }
        return Outcome.success(ingest(actor.getValue().getAccountId(), request));
    }

    /**
     * All readings and all their alerts commit together or not at all.
     */
    @Transactional
    public Outcome<BatchSubmissionResponse> submitBatch(AuthenticatedIdentity identity, VitalSignBatchRequest request) {
        Outcome<Account> actor = authorizer.authorizeOwnClinicalData(identity, "vitals.submit_batch");
        if (actor.isFailure()) {
            return actor.propagate();
        }

        UUID subjectId = actor.getValue().getAccountId();
        int alertsCreated = 0;
        for (VitalSignRequest reading : request.getReadings()) {
            alertsCreated += ingest(subjectId, reading).getAlertsCreated();
        }
        log.info("Stored batch of {} readings for subject {} ({} alerts)", request.getReadings().size(), subjectId,
                alertsCreated);
        return Outcome.success(new BatchSubmissionResponse(request.getReadings().size(), alertsCreated));
    }

    /**
     * Stores one reading and evaluates it. Any failure in alert evaluation propagates
     * and rolls back the reading with it. Readings for one subject are processed one
     * at a time so deduplication always sees the previous reading's alerts.
     */
    @Transactional
    public VitalSubmissionResponse ingest(UUID subjectId, VitalSignRequest request) {
        accountRepository.findByIdForUpdate(subjectId)
                .orElseThrow(() -> new IllegalStateException("No account for subject " + subjectId));

        LocalDateTime now = LocalDateTime.now(clock);
        VitalSignRecord record = vitalSignRepository.save(VitalSignRecord.builder()
                .subjectId(subjectId)
                .heartRate(request.getHeartRate())
                .spo2(request.getSpo2())
                .systolicBp(request.getSystolicBp())
                .diastolicBp(request.getDiastolicBp())
                .hrv(request.getHrv())
                .sourceDevice(request.getSourceDevice())
                .deviceId(request.getDeviceId())
                .recordedAt(request.getTimestamp() != null ? request.getTimestamp() : now)
                .createdAt(now)
                .build());

        List<AlertRecord> alerts = alertEngine.evaluate(subjectId, record);
        log.debug("Stored reading {} for subject {} with {} alert(s)", record.getReadingId(), subjectId, alerts.size());
        return new VitalSubmissionResponse(record.getReadingId(), alerts.size());
    }

    @Transactional(readOnly = true)
    public Outcome<VitalSignResponse> latest(AuthenticatedIdentity identity, UUID subjectId) {
        Outcome<UUID> subject = resolveSubject(identity, subjectId, "vitals.latest");
        if (subject.isFailure()) {
            return subject.propagate();
        }
        return vitalSignRepository.findFirstBySubjectIdOrderByRecordedAtDesc(subject.getValue())
                .map(record -> Outcome.success(VitalSignResponse.from(record)))
                .orElseGet(() -> Outcome.failure(ErrorCode.NOT_FOUND, "No vital signs recorded"));
    }

    @Transactional(readOnly = true)
    public Outcome<PageResponse<VitalSignResponse>> history(AuthenticatedIdentity identity, UUID subjectId,
                                                            int page, int perPage) {
        Outcome<UUID> subject = resolveSubject(identity, subjectId, "vitals.history");
        if (subject.isFailure()) {
            return subject.propagate();
        }
        PageRequest pageable = PageRequest.of(Math.max(page, 1) - 1, Math.min(Math.max(perPage, 1), MAX_PAGE_SIZE));
        return Outcome.success(PageResponse.from(
                vitalSignRepository.findBySubjectIdOrderByRecordedAtDesc(subject.getValue(), pageable),
                VitalSignResponse::from));
    }

    /**
     * {@code null} subject means the caller's own data.
     */
    private Outcome<UUID> resolveSubject(AuthenticatedIdentity identity, UUID subjectId, String operation) {
        Outcome<Account> actor = subjectId == null
                ? authorizer.authorizeOwnClinicalData(identity, operation)
                : authorizer.authorizePhiAccess(identity, subjectId, operation);
        return actor.map(account -> subjectId != null ? subjectId : account.getAccountId());
    }
}

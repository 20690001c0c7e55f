package com.adaptiv.healthservice.repository;

import com.adaptiv.healthservice.models.ConsentRecord;
import com.adaptiv.healthservice.models.ShareState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Every transition is a single conditional update on the expected current state.
 * A return value of 0 means the row was not in that state any more.
 */
@Repository
public interface ConsentRecordRepository extends JpaRepository<ConsentRecord, UUID> {

    List<ConsentRecord> findByShareStateOrderByRequestedAtAsc(ShareState shareState);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ConsentRecord c SET c.shareState = com.adaptiv.healthservice.models.ShareState.DISABLE_REQUESTED, " +
            "c.requestedAt = :now, c.requestedBy = :patientId, c.reason = :reason, " +
            "c.reviewedAt = null, c.reviewedBy = null, c.decision = null, c.updatedAt = :now " +
            "WHERE c.patientId = :patientId AND c.shareState = com.adaptiv.healthservice.models.ShareState.ON")
    int markDisableRequested(@Param("patientId") UUID patientId,
                             @Param("reason") String reason,
                             @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ConsentRecord c SET c.shareState = com.adaptiv.healthservice.models.ShareState.OFF, " +
            "c.reviewedAt = :now, c.reviewedBy = :reviewerId, " +
            "c.decision = com.adaptiv.healthservice.models.ConsentDecision.APPROVE, " +
            "c.reason = COALESCE(:reason, c.reason), c.updatedAt = :now " +
            "WHERE c.patientId = :patientId AND c.shareState = com.adaptiv.healthservice.models.ShareState.DISABLE_REQUESTED")
    int approveDisable(@Param("patientId") UUID patientId,
                       @Param("reviewerId") UUID reviewerId,
                       @Param("reason") String reason,
                       @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ConsentRecord c SET c.shareState = com.adaptiv.healthservice.models.ShareState.ON, " +
            "c.requestedAt = null, c.requestedBy = null, " +
            "c.reviewedAt = :now, c.reviewedBy = :reviewerId, " +
            "c.decision = com.adaptiv.healthservice.models.ConsentDecision.REJECT, " +
            "c.reason = COALESCE(:reason, c.reason), c.updatedAt = :now " +
            "WHERE c.patientId = :patientId AND c.shareState = com.adaptiv.healthservice.models.ShareState.DISABLE_REQUESTED")
    int rejectDisable(@Param("patientId") UUID patientId,
                      @Param("reviewerId") UUID reviewerId,
                      @Param("reason") String reason,
                      @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ConsentRecord c SET c.shareState = com.adaptiv.healthservice.models.ShareState.ON, " +
            "c.requestedAt = null, c.requestedBy = null, c.reviewedAt = null, c.reviewedBy = null, " +
            "c.decision = null, c.reason = null, c.updatedAt = :now " +
            "WHERE c.patientId = :patientId AND c.shareState = :expected")
    int enableSharing(@Param("patientId") UUID patientId,
                      @Param("expected") ShareState expected,
                      @Param("now") LocalDateTime now);
}

package com.adaptiv.healthservice.repository;

import com.adaptiv.healthservice.models.AlertRecord;
import com.adaptiv.healthservice.models.AlertType;
import com.adaptiv.healthservice.models.Severity;
import com.adaptiv.healthservice.models.ShareState;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface AlertRecordRepository extends JpaRepository<AlertRecord, Long> {

    /**
     * Retires active alerts of the same subject and type raised since {@code since}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AlertRecord a SET a.superseded = true " +
            "WHERE a.subjectId = :subjectId AND a.alertType = :alertType " +
            "AND a.superseded = false AND a.resolvedAt IS NULL AND a.createdAt >= :since")
    int supersedeRecent(@Param("subjectId") UUID subjectId,
                        @Param("alertType") AlertType alertType,
                        @Param("since") LocalDateTime since);

    @Query("SELECT a FROM AlertRecord a WHERE a.subjectId = :subjectId " +
            "AND (:includeInactive = true OR (a.superseded = false AND a.resolvedAt IS NULL)) " +
            "AND (:acknowledged IS NULL OR a.acknowledged = :acknowledged) " +
            "AND (:severity IS NULL OR a.severity = :severity) " +
            "ORDER BY a.createdAt DESC, a.alertId DESC")
    Page<AlertRecord> search(@Param("subjectId") UUID subjectId,
                             @Param("includeInactive") boolean includeInactive,
                             @Param("acknowledged") Boolean acknowledged,
                             @Param("severity") Severity severity,
                             Pageable pageable);

    List<AlertRecord> findBySubjectIdAndAlertTypeOrderByCreatedAtAsc(UUID subjectId, AlertType alertType);

    List<AlertRecord> findBySubjectId(UUID subjectId);

    /**
     * Severity breakdown across patients whose data is still shared.
     */
    @Query("SELECT a.severity, COUNT(a) FROM AlertRecord a WHERE a.createdAt >= :since " +
            "AND a.subjectId IN (SELECT c.patientId FROM ConsentRecord c WHERE c.shareState <> :excluded) " +
            "GROUP BY a.severity")
    List<Object[]> countBySeveritySince(@Param("since") LocalDateTime since,
                                        @Param("excluded") ShareState excluded);

    @Query("SELECT COUNT(a) FROM AlertRecord a WHERE a.createdAt >= :since AND a.acknowledged = false " +
            "AND a.subjectId IN (SELECT c.patientId FROM ConsentRecord c WHERE c.shareState <> :excluded)")
    long countUnacknowledgedSince(@Param("since") LocalDateTime since,
                                  @Param("excluded") ShareState excluded);
}

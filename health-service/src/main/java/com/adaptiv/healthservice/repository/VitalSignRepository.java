package com.adaptiv.healthservice.repository;

import com.adaptiv.healthservice.models.VitalSignRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface VitalSignRepository extends JpaRepository<VitalSignRecord, Long> {

    Optional<VitalSignRecord> findFirstBySubjectIdOrderByRecordedAtDesc(UUID subjectId);

    Page<VitalSignRecord> findBySubjectIdOrderByRecordedAtDesc(UUID subjectId, Pageable pageable);

    long countBySubjectId(UUID subjectId);
}

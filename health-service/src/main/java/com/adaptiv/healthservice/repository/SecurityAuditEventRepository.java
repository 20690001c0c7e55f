package com.adaptiv.healthservice.repository;

import com.adaptiv.healthservice.models.SecurityAuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SecurityAuditEventRepository extends JpaRepository<SecurityAuditEvent, Long> {

    List<SecurityAuditEvent> findByActorIdOrderByEventTimeAsc(UUID actorId);
}

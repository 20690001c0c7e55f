package com.adaptiv.healthservice.services;

import com.adaptiv.healthservice.models.SecurityAuditEvent;
import com.adaptiv.healthservice.repository.SecurityAuditEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists audit events in their own transaction, off the request thread,
 * so an event survives the rollback of the request that produced it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityEventWriter {

    private final SecurityAuditEventRepository securityEvents;

    @Async("securityEventExecutor")
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void write(SecurityAuditEvent event) {
        try {
            SecurityAuditEvent saved = securityEvents.save(event);
            log.debug("Saved security event {} with id: {}", saved.getEventType(), saved.getEventId());
        } catch (Exception e) {
            log.error("Failed to save security event {} for actor {}", event.getEventType(), event.getActorId(), e);
        }
    }
}

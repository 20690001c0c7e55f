package com.adaptiv.healthservice.services;

import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.models.SecurityAuditEvent;
import com.adaptiv.healthservice.models.SecurityAuditEvent.EventType;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Records security-relevant events. Request details are captured on the calling
 * thread; the write itself is handed to {@link SecurityEventWriter}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SecurityAuditService {

    private final SecurityEventWriter writer;
    private final Clock clock;

    public void record(EventType eventType, UUID actorId, UUID targetId, String reasonCode, String eventData) {
        HttpServletRequest request = currentRequest();
        SecurityAuditEvent event = SecurityAuditEvent.builder()
                .eventType(eventType)
                .actorId(actorId)
                .targetId(targetId)
                .reasonCode(reasonCode)
                .eventData(eventData)
                .eventTime(LocalDateTime.now(clock))
                .ipAddress(getIpAddress(request))
                .userAgent(getUserAgent(request))
                .build();
        try {
            writer.write(event);
        } catch (TaskRejectedException e) {
            // Audit backlog must never undo the policy write that triggered it.
            log.error("Security event {} for actor {} dropped, audit executor rejected it: {}",
                    eventType, actorId, e.getMessage());
        }
    }

    public void recordDenial(UUID actorId, UUID targetId, ErrorCode reason, String operation) {
        log.warn("Access denied: actor={} target={} reason={} operation={}", actorId, targetId, reason, operation);
        record(EventType.ACCESS_DENIED, actorId, targetId, reason.name(), operation);
    }

    private static HttpServletRequest currentRequest() {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        return attributes != null ? attributes.getRequest() : null;
    }

    public static String getIpAddress(HttpServletRequest request) {
        if (request == null) return "UNKNOWN";

        String ip = request.getHeader("X-Forwarded-For");
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getHeader("X-Real-IP");
        }
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getRemoteAddr();
        }
        return ip != null ? ip.split(",")[0].trim() : "UNKNOWN";
    }

    public static String getUserAgent(HttpServletRequest request) {
        if (request == null) return "UNKNOWN";
        String userAgent = request.getHeader("User-Agent");
        if (userAgent == null) return "UNKNOWN";
        return userAgent.length() > 255 ? userAgent.substring(0, 255) : userAgent;
    }

    public static String maskEmail(String email) {
        if (email == null || !email.contains("@")) {
            return "***";
        }
        String[] parts = email.split("@", 2);
        String local = parts[0];
        String masked = local.length() <= 2 ? "**" : local.charAt(0) + "***" + local.charAt(local.length() - 1);
        return masked + "@" + parts[1];
    }
}

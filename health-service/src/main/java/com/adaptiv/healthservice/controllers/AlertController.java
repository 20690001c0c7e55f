package com.adaptiv.healthservice.controllers;

import com.adaptiv.healthservice.dto.alerts.ResolveAlertRequest;
import com.adaptiv.healthservice.exceptions.ApiResponses;
import com.adaptiv.healthservice.models.Severity;
import com.adaptiv.healthservice.services.alerts.AlertQuery;
import com.adaptiv.healthservice.services.alerts.AlertService;
import com.adaptiv.healthservice.services.authorization.AuthenticatedIdentity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertService alertService;

    @GetMapping
    public ResponseEntity<Object> listOwn(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                          @RequestParam(defaultValue = "1") int page,
                                          @RequestParam(name = "per_page", defaultValue = "20") int perPage,
                                          @RequestParam(required = false) Boolean acknowledged,
                                          @RequestParam(required = false) Severity severity,
                                          @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return ApiResponses.from(alertService.listOwn(identity,
                query(page, perPage, acknowledged, severity, includeInactive)));
    }

    @GetMapping("/user/{patientId}")
    public ResponseEntity<Object> listForPatient(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                                 @PathVariable UUID patientId,
                                                 @RequestParam(defaultValue = "1") int page,
                                                 @RequestParam(name = "per_page", defaultValue = "20") int perPage,
                                                 @RequestParam(required = false) Boolean acknowledged,
                                                 @RequestParam(required = false) Severity severity,
                                                 @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return ApiResponses.from(alertService.listForPatient(identity, patientId,
                query(page, perPage, acknowledged, severity, includeInactive)));
    }

    @PatchMapping("/{alertId}/acknowledge")
    public ResponseEntity<Object> acknowledge(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                              @PathVariable Long alertId) {
        return ApiResponses.from(alertService.acknowledge(identity, alertId));
    }

    @PatchMapping("/{alertId}/resolve")
    public ResponseEntity<Object> resolve(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                          @PathVariable Long alertId,
                                          @RequestBody(required = false) @Valid ResolveAlertRequest request) {
        String notes = request != null ? request.getResolutionNotes() : null;
        return ApiResponses.from(alertService.resolve(identity, alertId, notes));
    }

    @GetMapping("/stats")
    public ResponseEntity<Object> stats(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                        @RequestParam(defaultValue = "7") int days) {
        return ApiResponses.from(alertService.stats(identity, days));
    }

    private static AlertQuery query(int page, int perPage, Boolean acknowledged, Severity severity,
                                    boolean includeInactive) {
        return AlertQuery.builder()
                .page(page)
                .perPage(perPage)
                .acknowledged(acknowledged)
                .severity(severity)
                .includeInactive(includeInactive)
                .build();
    }
}

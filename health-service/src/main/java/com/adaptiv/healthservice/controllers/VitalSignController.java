package com.adaptiv.healthservice.controllers;

import com.adaptiv.healthservice.dto.vitals.VitalSignBatchRequest;
import com.adaptiv.healthservice.dto.vitals.VitalSignRequest;
import com.adaptiv.healthservice.exceptions.ApiResponses;
import com.adaptiv.healthservice.services.authorization.AuthenticatedIdentity;
import com.adaptiv.healthservice.services.vitals.VitalSignService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/vitals")
@RequiredArgsConstructor
public class VitalSignController {

    private final VitalSignService vitalSignService;

    /**
     * Store a reading for the caller. Alerts are evaluated before the response is sent.
     */
    @PostMapping
    public ResponseEntity<Object> submit(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                         @RequestBody @Valid VitalSignRequest request) {
        return ApiResponses.from(vitalSignService.submit(identity, request), HttpStatus.CREATED);
    }

    @PostMapping("/batch")
    public ResponseEntity<Object> submitBatch(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                              @RequestBody @Valid VitalSignBatchRequest request) {
        return ApiResponses.from(vitalSignService.submitBatch(identity, request), HttpStatus.CREATED);
    }

    @GetMapping("/latest")
    public ResponseEntity<Object> latest(@AuthenticationPrincipal AuthenticatedIdentity identity) {
        return ApiResponses.from(vitalSignService.latest(identity, null));
    }

    @GetMapping("/history")
    public ResponseEntity<Object> history(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                          @RequestParam(defaultValue = "1") int page,
                                          @RequestParam(name = "per_page", defaultValue = "50") int perPage) {
        return ApiResponses.from(vitalSignService.history(identity, null, page, perPage));
    }

    @GetMapping("/user/{patientId}/latest")
    public ResponseEntity<Object> latestForPatient(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                                   @PathVariable UUID patientId) {
        return ApiResponses.from(vitalSignService.latest(identity, patientId));
    }

    @GetMapping("/user/{patientId}/history")
    public ResponseEntity<Object> historyForPatient(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                                    @PathVariable UUID patientId,
                                                    @RequestParam(defaultValue = "1") int page,
                                                    @RequestParam(name = "per_page", defaultValue = "50") int perPage) {
        return ApiResponses.from(vitalSignService.history(identity, patientId, page, perPage));
    }
}

package com.adaptiv.healthservice.controllers;

import com.adaptiv.healthservice.dto.consent.ConsentReviewRequest;
import com.adaptiv.healthservice.dto.consent.DisableConsentRequest;
import com.adaptiv.healthservice.exceptions.ApiResponses;
import com.adaptiv.healthservice.services.authorization.AuthenticatedIdentity;
import com.adaptiv.healthservice.services.consent.ConsentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/consent")
@RequiredArgsConstructor
public class ConsentController {

    private final ConsentService consentService;

    @GetMapping("/status")
    public ResponseEntity<Object> status(@AuthenticationPrincipal AuthenticatedIdentity identity) {
        return ApiResponses.from(consentService.status(identity));
    }

    @PostMapping("/disable")
    public ResponseEntity<Object> requestDisable(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                                 @RequestBody(required = false) @Valid DisableConsentRequest request) {
        String reason = request != null ? request.getReason() : null;
        return ApiResponses.from(consentService.requestDisable(identity, reason));
    }

    @PostMapping("/enable")
    public ResponseEntity<Object> enable(@AuthenticationPrincipal AuthenticatedIdentity identity) {
        return ApiResponses.from(consentService.enable(identity));
    }

    @GetMapping("/pending")
    public ResponseEntity<Object> pending(@AuthenticationPrincipal AuthenticatedIdentity identity) {
        return ApiResponses.from(consentService.pending(identity));
    }

    @PostMapping("/{patientId}/review")
    public ResponseEntity<Object> review(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                         @PathVariable UUID patientId,
                                         @RequestBody @Valid ConsentReviewRequest request) {
        return ApiResponses.from(consentService.review(identity, patientId, request.getDecision(), request.getReason()));
    }
}

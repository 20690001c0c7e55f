package com.adaptiv.healthservice.services.consent;

import com.adaptiv.healthservice.dto.consent.ConsentStatusResponse;
import com.adaptiv.healthservice.dto.consent.PendingConsentResponse;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.ConsentDecision;
import com.adaptiv.healthservice.models.ConsentRecord;
import com.adaptiv.healthservice.repository.AccountRepository;
import com.adaptiv.healthservice.services.authorization.AuthenticatedIdentity;
import com.adaptiv.healthservice.services.authorization.Authorizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Access rules in front of {@link ConsentEngine}: patients drive their own
 * sharing state, clinicians review pending requests.
 */
@Service
@RequiredArgsConstructor
public class ConsentService {

    private final ConsentEngine consentEngine;
    private final Authorizer authorizer;
    private final AccountRepository accountRepository;

    @Transactional(readOnly = true)
    public Outcome<ConsentStatusResponse> status(AuthenticatedIdentity identity) {
        return authorizer.authorizePatient(identity, "consent.status")
                .flatMap(patient -> consentEngine.status(patient.getAccountId()))
                .map(ConsentStatusResponse::from);
    }

    @Transactional
    public Outcome<ConsentStatusResponse> requestDisable(AuthenticatedIdentity identity, String reason) {
        return authorizer.authorizePatient(identity, "consent.disable")
                .flatMap(patient -> consentEngine.requestDisable(patient.getAccountId(), reason))
                .map(ConsentStatusResponse::from);
    }

    @Transactional
    public Outcome<ConsentStatusResponse> enable(AuthenticatedIdentity identity) {
        return authorizer.authorizePatient(identity, "consent.enable")
                .flatMap(patient -> consentEngine.enable(patient.getAccountId()))
                .map(ConsentStatusResponse::from);
    }

    @Transactional(readOnly = true)
    public Outcome<List<PendingConsentResponse>> pending(AuthenticatedIdentity identity) {
        return authorizer.authorizeClinician(identity, "consent.pending")
                .map(clinician -> toPendingResponses(consentEngine.pendingRequests()));
    }

    @Transactional
    public Outcome<ConsentStatusResponse> review(AuthenticatedIdentity identity, UUID patientId,
                                                 ConsentDecision decision, String reason) {
        return authorizer.authorizeClinician(identity, "consent.review")
                .flatMap(clinician -> consentEngine.review(clinician.getAccountId(), patientId, decision, reason))
                .map(ConsentStatusResponse::from);
    }

    private List<PendingConsentResponse> toPendingResponses(List<ConsentRecord> records) {
        Map<UUID, Account> patients = accountRepository
                .findAllById(records.stream().map(ConsentRecord::getPatientId).toList())
                .stream()
                .collect(Collectors.toMap(Account::getAccountId, Function.identity()));

        return records.stream()
                .map(record -> {
                    Account patient = patients.get(record.getPatientId());
                    return PendingConsentResponse.builder()
                            .patientId(record.getPatientId())
                            .email(patient != null ? patient.getEmail() : null)
                            .fullName(patient != null ? patient.getFullName() : null)
                            .requestedAt(record.getRequestedAt())
                            .reason(record.getReason())
                            .build();
                })
                .toList();
    }
}

package com.adaptiv.healthservice.controllers;

import com.adaptiv.healthservice.dto.admin.AdminPasswordResetRequest;
import com.adaptiv.healthservice.dto.admin.ProvisionAccountRequest;
import com.adaptiv.healthservice.exceptions.ApiResponses;
import com.adaptiv.healthservice.services.account.AccountService;
import com.adaptiv.healthservice.services.authorization.AuthenticatedIdentity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Account administration. Admin only; responses never include clinical data.
 */
@RestController
@RequestMapping("/api/v1/admin/accounts")
@RequiredArgsConstructor
public class AdminAccountController {

    private final AccountService accountService;

    @PostMapping
    public ResponseEntity<Object> provision(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                            @RequestBody @Valid ProvisionAccountRequest request) {
        return ApiResponses.from(accountService.provision(identity, request), HttpStatus.CREATED);
    }

    @GetMapping
    public ResponseEntity<Object> list(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                       @RequestParam(defaultValue = "1") int page,
                                       @RequestParam(name = "per_page", defaultValue = "20") int perPage) {
        return ApiResponses.from(accountService.list(identity, page, perPage));
    }

    @DeleteMapping("/{accountId}")
    public ResponseEntity<Object> deactivate(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                             @PathVariable UUID accountId) {
        return ApiResponses.from(accountService.deactivate(identity, accountId));
    }

    @PostMapping("/{accountId}/password")
    public ResponseEntity<Object> resetPassword(@AuthenticationPrincipal AuthenticatedIdentity identity,
                                                @PathVariable UUID accountId,
                                                @RequestBody @Valid AdminPasswordResetRequest request) {
        return ApiResponses.from(accountService.resetPassword(identity, accountId, request.getNewPassword()));
    }
}

package com.adaptiv.healthservice.controllers;

import com.adaptiv.healthservice.annotations.RateLimited;
import com.adaptiv.healthservice.dto.auth.LoginRequest;
import com.adaptiv.healthservice.dto.auth.MessageResponse;
import com.adaptiv.healthservice.dto.auth.PasswordResetConfirmRequest;
import com.adaptiv.healthservice.dto.auth.PasswordResetRequest;
import com.adaptiv.healthservice.dto.auth.RefreshRequest;
import com.adaptiv.healthservice.dto.auth.TokenResponse;
import com.adaptiv.healthservice.exceptions.ApiResponses;
import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.services.account.AccountService;
import com.adaptiv.healthservice.services.authentication.Authenticator;
import com.adaptiv.healthservice.services.authentication.PasswordResetService;
import com.adaptiv.healthservice.services.authorization.AuthenticatedIdentity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private static final String RESET_REQUESTED_MESSAGE =
            "If an account exists for this email, a password reset link has been sent.";

    private final Authenticator authenticator;
    private final PasswordResetService passwordResetService;
    private final AccountService accountService;

    /**
     * Exchange email and password for an access and refresh token.
     * 401 for bad credentials or an inactive account, 423 with Retry-After while locked.
     */
    @PostMapping("/login")
    @RateLimited(maxRequests = 10, windowSeconds = 300, message = "Too many login attempts. Please try again in 5 minutes.")
    public ResponseEntity<Object> login(@RequestBody @Valid LoginRequest request) {
        return ApiResponses.from(authenticator.authenticate(request.getEmail(), request.getPassword())
                .map(TokenResponse::from));
    }

    @PostMapping("/refresh")
    @RateLimited(maxRequests = 10, windowSeconds = 60, message = "Too many refresh requests. Please wait a moment.")
    public ResponseEntity<Object> refresh(@RequestBody @Valid RefreshRequest request) {
        return ApiResponses.from(authenticator.refresh(request.getRefreshToken()).map(TokenResponse::from));
    }

    /**
     * Always 200 with the same message, whether or not the email is registered.
     */
    @PostMapping("/reset-password")
    @RateLimited(maxRequests = 3, windowSeconds = 300, message = "Too many reset requests. Please try again later.")
    public ResponseEntity<Object> requestPasswordReset(@RequestBody @Valid PasswordResetRequest request) {
        passwordResetService.requestReset(request.getEmail());
        return ResponseEntity.ok(new MessageResponse(true, RESET_REQUESTED_MESSAGE));
    }

    /**
     * 400 for an invalid, expired, used or wrong-type token.
     */
    @PostMapping("/reset-password/confirm")
    @RateLimited(maxRequests = 5, windowSeconds = 300)
    public ResponseEntity<Object> confirmPasswordReset(@RequestBody @Valid PasswordResetConfirmRequest request) {
        Outcome<Void> outcome = passwordResetService.confirmReset(request.getToken(), request.getNewPassword());
        if (outcome.isFailure()) {
            return ApiResponses.failure(outcome, HttpStatus.BAD_REQUEST);
        }
        return ResponseEntity.ok(new MessageResponse(true, "Password has been reset successfully"));
    }

    @GetMapping("/me")
    public ResponseEntity<Object> me(@AuthenticationPrincipal AuthenticatedIdentity identity) {
        return ApiResponses.from(accountService.currentAccount(identity));
    }
}

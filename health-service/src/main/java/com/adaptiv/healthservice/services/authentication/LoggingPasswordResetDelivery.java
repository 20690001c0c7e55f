package com.adaptiv.healthservice.services.authentication;

import com.adaptiv.healthservice.models.Account;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.adaptiv.healthservice.services.SecurityAuditService.maskEmail;

/**
 * Placeholder delivery until an outbound mail channel exists. Never logs the token itself.
 */
@Slf4j
@Component
public class LoggingPasswordResetDelivery implements PasswordResetDelivery {

    @Override
    public void deliver(Account account, String resetToken) {
        log.info("Password reset token issued for {} (account {})", maskEmail(account.getEmail()), account.getAccountId());
    }
}

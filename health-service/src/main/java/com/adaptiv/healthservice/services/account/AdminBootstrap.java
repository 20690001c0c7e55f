package com.adaptiv.healthservice.services.account;

import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.Role;
import com.adaptiv.healthservice.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the first administrator on startup when none exists, so accounts can be provisioned at all.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminBootstrap implements ApplicationRunner {

    private final AccountRepository accountRepository;
    private final AccountService accountService;

    @Value("${app.bootstrap.admin-email:}")
    private String adminEmail;

    @Value("${app.bootstrap.admin-password:}")
    private String adminPassword;

    @Override
    public void run(ApplicationArguments args) {
        if (adminEmail.isBlank() || adminPassword.isBlank()) {
            log.debug("No bootstrap administrator configured");
            return;
        }
        if (accountRepository.existsByRole(Role.ADMIN)) {
            log.debug("Administrator already present, skipping bootstrap");
            return;
        }

        Outcome<Account> created = accountService.createAccount(adminEmail, adminPassword, "Administrator", Role.ADMIN);
        if (created.isSuccess()) {
            log.info("Bootstrap administrator created: {}", created.getValue().getAccountId());
        } else {
            log.warn("Bootstrap administrator not created: {}", created.getMessage());
        }
    }
}

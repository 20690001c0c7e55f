package com.adaptiv.healthservice.services.authentication;

import com.adaptiv.healthservice.exceptions.ErrorCode;
import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.Credential;
import com.adaptiv.healthservice.services.SecurityEventWriter;
import com.adaptiv.healthservice.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

/**
 * Lockout bookkeeping when the audit executor refuses work.
 */
class AuditBacklogLockoutTest extends IntegrationTestSupport {

    @Autowired
    private Authenticator authenticator;

    @MockBean
    private SecurityEventWriter securityEventWriter;

    @Test
    void failedLoginsStillLockWhenAuditQueueIsFull() {
        doThrow(new TaskRejectedException("audit queue full")).when(securityEventWriter).write(any());
        Account account = patient("ana@example.com");

        for (int i = 0; i < 3; i++) {
            assertEquals(ErrorCode.INVALID_CREDENTIALS, authenticator.authenticate("ana@example.com", "wrong").getError());
        }

        assertEquals(ErrorCode.ACCOUNT_LOCKED, authenticator.authenticate("ana@example.com", PASSWORD).getError());
        Credential credential = credentialRepository.findById(account.getAccountId()).orElseThrow();
        assertEquals(3, credential.getFailedAttempts());
        assertNotNull(credential.getLockoutExpiresAt());
        verify(securityEventWriter, atLeastOnce()).write(any());
    }
}

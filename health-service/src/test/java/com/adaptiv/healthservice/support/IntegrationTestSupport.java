package com.adaptiv.healthservice.support;

import com.adaptiv.healthservice.models.Account;
import com.adaptiv.healthservice.models.Role;
import com.adaptiv.healthservice.repository.AccountRepository;
import com.adaptiv.healthservice.repository.AlertRecordRepository;
import com.adaptiv.healthservice.repository.ConsentRecordRepository;
import com.adaptiv.healthservice.repository.CredentialRepository;
import com.adaptiv.healthservice.repository.VitalSignRepository;
import com.adaptiv.healthservice.services.account.AccountService;
import com.adaptiv.healthservice.services.authentication.PasswordResetDelivery;
import com.adaptiv.healthservice.services.authorization.AuthenticatedIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

/**
 * Full application context against in-memory H2. Tables are emptied and the
 * clock rewound before every test, so tests do not run inside a transaction
 * and see exactly what a request would commit.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
public abstract class IntegrationTestSupport {

    public static final String PASSWORD = "correct-horse-battery";

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected AccountService accountService;

    @Autowired
    protected AccountRepository accountRepository;

    @Autowired
    protected CredentialRepository credentialRepository;

    @Autowired
    protected ConsentRecordRepository consentRepository;

    @Autowired
    protected VitalSignRepository vitalSignRepository;

    @Autowired
    protected AlertRecordRepository alertRepository;

    @MockBean
    protected PasswordResetDelivery resetDelivery;

    @BeforeEach
    void resetState() {
        clock.reset();
        alertRepository.deleteAllInBatch();
        vitalSignRepository.deleteAllInBatch();
        consentRepository.deleteAllInBatch();
        credentialRepository.deleteAllInBatch();
        accountRepository.deleteAllInBatch();
    }

    protected Account patient(String email) {
        return create(email, Role.PATIENT);
    }

    protected Account clinician(String email) {
        return create(email, Role.CLINICIAN);
    }

    protected Account admin(String email) {
        return create(email, Role.ADMIN);
    }

    protected Account create(String email, Role role) {
        return accountService.createAccount(email, PASSWORD, "Test " + role, role).getValue();
    }

    protected static AuthenticatedIdentity identity(Account account) {
        return new AuthenticatedIdentity(account.getAccountId(), account.getRole());
    }
}

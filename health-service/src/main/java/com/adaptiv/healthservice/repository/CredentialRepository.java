package com.adaptiv.healthservice.repository;

import com.adaptiv.healthservice.models.Credential;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CredentialRepository extends JpaRepository<Credential, UUID> {

    /**
     * Moves the failure counter from {@code expected} to {@code next}.
     * Returns 0 when another request changed the counter first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Credential c SET c.failedAttempts = :next, c.lockoutExpiresAt = :lockoutUntil " +
            "WHERE c.accountId = :accountId AND c.failedAttempts = :expected")
    int compareAndSetFailedAttempts(@Param("accountId") UUID accountId,
                                    @Param("expected") int expected,
                                    @Param("next") int next,
                                    @Param("lockoutUntil") LocalDateTime lockoutUntil);

    /**
     * Row-locked read. Holds the credential for the rest of the transaction so the
     * lockout check, password check and counter update of one login cannot interleave
     * with another login for the same account.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Credential c WHERE c.accountId = :accountId")
    Optional<Credential> findByIdForUpdate(@Param("accountId") UUID accountId);

    @Query("SELECT c.failedAttempts FROM Credential c WHERE c.accountId = :accountId")
    Optional<Integer> findFailedAttempts(@Param("accountId") UUID accountId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Credential c SET c.failedAttempts = 0, c.lockoutExpiresAt = null WHERE c.accountId = :accountId")
    int clearLockout(@Param("accountId") UUID accountId);
}

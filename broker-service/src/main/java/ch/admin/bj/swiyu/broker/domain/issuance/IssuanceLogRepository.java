/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.issuance;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface IssuanceLogRepository extends JpaRepository<IssuanceLog, Long> {

    /**
     * Looks up a transaction only if it belongs to the given person.
     */
    @Query("SELECT l FROM IssuanceLog l JOIN FETCH l.issuedCredential c " +
            "WHERE l.transactionId = :transactionId AND c.person.id = :personId")
    Optional<IssuanceLog> findByTransactionIdAndPersonId(String transactionId, Long personId);

    @Query("SELECT l FROM IssuanceLog l WHERE l.id = :id")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<IssuanceLog> findByIdForUpdate(Long id);

    @Query("SELECT l FROM IssuanceLog l JOIN FETCH l.issuedCredential c JOIN FETCH c.person JOIN FETCH c.template WHERE l.id = :id")
    Optional<IssuanceLog> findWithCredentialById(Long id);

    @Query("SELECT l.id FROM IssuanceLog l WHERE l.status = :status AND l.expiresAt < :now")
    List<Long> findIdsByStatusAndExpiresAtBefore(IssuanceLogStatus status, Instant now);
}

/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.verification;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface VerificationLogRepository extends JpaRepository<VerificationLog, Long> {

    Optional<VerificationLog> findByTransactionId(String transactionId);

    @Query("SELECT l FROM VerificationLog l WHERE l.id = :id")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<VerificationLog> findByIdForUpdate(Long id);

    @Query("SELECT l FROM VerificationLog l WHERE l.batchSession.id = :sessionId AND l.status = :status")
    List<VerificationLog> findAllByBatchSessionIdAndStatus(Long sessionId, VerificationStatus status);

    @Query("SELECT l FROM VerificationLog l WHERE l.batchSession.id = :sessionId " +
            "ORDER BY l.auditMetadata.createdAt DESC, l.id DESC")
    List<VerificationLog> findAllByBatchSessionIdNewestFirst(Long sessionId);

    @Query("SELECT l.id FROM VerificationLog l WHERE l.status = :status AND l.expiresAt < :now")
    List<Long> findIdsByStatusAndExpiresAtBefore(VerificationStatus status, Instant now);
}

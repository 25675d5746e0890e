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
import java.util.UUID;

@Repository
public interface BatchVerificationSessionRepository extends JpaRepository<BatchVerificationSession, Long> {

    Optional<BatchVerificationSession> findByUuid(UUID uuid);

    @Query("SELECT s FROM BatchVerificationSession s WHERE s.id = :id")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<BatchVerificationSession> findByIdForUpdate(Long id);

    @Query("SELECT s.id FROM BatchVerificationSession s WHERE s.status = :status AND s.expiresAt < :now")
    List<Long> findIdsByStatusAndExpiresAtBefore(BatchVerificationStatus status, Instant now);
}

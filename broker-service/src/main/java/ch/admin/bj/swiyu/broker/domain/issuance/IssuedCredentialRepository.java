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

import java.util.List;
import java.util.Optional;

@Repository
public interface IssuedCredentialRepository extends JpaRepository<IssuedCredential, Long> {

    @Query("SELECT c FROM IssuedCredential c WHERE c.id = :id")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    Optional<IssuedCredential> findByIdForUpdate(Long id);

    /**
     * All attempts of a person for one template, locked for the duration of the transaction.
     */
    @Query("SELECT c FROM IssuedCredential c WHERE c.person.id = :personId AND c.template.id = :templateId ORDER BY c.id")
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    List<IssuedCredential> findAllByPersonAndTemplateForUpdate(Long personId, Integer templateId);

    @Query("SELECT c FROM IssuedCredential c JOIN FETCH c.template WHERE c.person.id = :personId AND c.status = :status ORDER BY c.id")
    List<IssuedCredential> findAllWithTemplateByPersonIdAndStatus(Long personId, IssuedCredentialStatus status);

    @Query("SELECT DISTINCT c.template.id FROM IssuedCredential c WHERE c.person.id = :personId AND c.status = :status")
    List<Integer> findTemplateIdsByPersonIdAndStatus(Long personId, IssuedCredentialStatus status);
}

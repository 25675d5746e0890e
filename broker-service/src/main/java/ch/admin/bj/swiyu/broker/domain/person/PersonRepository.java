/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.person;

import ch.admin.bj.swiyu.broker.domain.issuance.IssuedCredentialStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PersonRepository extends JpaRepository<Person, Long> {

    Optional<Person> findByPersonalId(String personalId);

    /**
     * Persons that do not hold any credential in the given status.
     */
    @Query("SELECT p FROM Person p WHERE NOT EXISTS " +
            "(SELECT c.id FROM IssuedCredential c WHERE c.person = p AND c.status = :status)")
    List<Person> findAllWithoutCredentialInStatus(IssuedCredentialStatus status);
}

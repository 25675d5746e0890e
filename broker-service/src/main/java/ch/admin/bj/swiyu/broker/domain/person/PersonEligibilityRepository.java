/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.person;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PersonEligibilityRepository extends JpaRepository<PersonEligibility, Long> {

    @Query("SELECT e.template.id FROM PersonEligibility e WHERE e.person.id = :personId")
    List<Integer> findTemplateIdsByPersonId(Long personId);

    boolean existsByPersonIdAndTemplateId(Long personId, Integer templateId);

    @Modifying
    @Query("DELETE FROM PersonEligibility e WHERE e.person.id = :personId AND e.template.id = :templateId")
    int deleteByPersonIdAndTemplateId(Long personId, Integer templateId);
}

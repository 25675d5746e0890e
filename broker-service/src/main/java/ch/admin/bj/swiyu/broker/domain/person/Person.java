/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.person;

import ch.admin.bj.swiyu.broker.domain.AuditMetadata;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDate;

/**
 * A means-tested person of the registry. Identity fields are imported and never changed by the broker.
 */
@Entity
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA
@AllArgsConstructor // test data
@EntityListeners(AuditingEntityListener.class)
@Table(name = "person")
public class Person {

    @Embedded
    private final AuditMetadata auditMetadata = new AuditMetadata();

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Identifier written into issued credentials and used to link verifications back to the person.
     */
    @NotNull
    @Column(unique = true)
    private String personalId;

    private String nationalId;

    private String name;

    private String county;

    private String district;

    private String address;

    private String phoneNumber;

    private LocalDate dateOfBirth;

    private String emergencyContactName;

    private String emergencyContactRelationship;

    private String emergencyContactPhone;

    private String reviewingAuthority;

    private String reviewerName;

    private String reviewerPhone;

    private LocalDate eligibilityStartDate;

    private LocalDate eligibilityEndDate;

    private Long personalAnnualIncome;

    private Long personalMovableAssets;

    private Long personalRealEstateAssets;

    private Long familyAnnualIncome;

    private Long familyMovableAssets;

    private Long familyRealEstateAssets;

    private String benefitLevel;
}

/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.person;

import ch.admin.bj.swiyu.broker.domain.AuditMetadata;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

/**
 * Credential type as registered on the wallet sandbox. Static reference data.
 */
@Entity
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA
@AllArgsConstructor // test data
@EntityListeners(AuditingEntityListener.class)
@Table(name = "vc_template")
public class VcTemplate {

    @Embedded
    private final AuditMetadata auditMetadata = new AuditMetadata();

    @Id
    private Integer id;

    private String templateName;

    /**
     * Identifier of the credential type on the wallet sandbox.
     */
    private String vcUid;

    private String description;

    private String cardImageUrl;
}

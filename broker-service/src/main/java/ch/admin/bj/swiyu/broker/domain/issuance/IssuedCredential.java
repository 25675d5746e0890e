/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.issuance;

import ch.admin.bj.swiyu.broker.domain.AuditMetadata;
import ch.admin.bj.swiyu.broker.domain.person.Person;
import ch.admin.bj.swiyu.broker.domain.person.VcTemplate;
import jakarta.annotation.Nullable;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.Map;

/**
 * One issuance attempt of a template for a person.
 * <p>
 * The external credential id ({@code cid}) is only known once the holder claimed the credential,
 * it is therefore only ever set together with the claim.
 */
@Entity
@Getter
@Builder
@Slf4j
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA
@AllArgsConstructor // test data
@EntityListeners(AuditingEntityListener.class)
@Table(name = "issued_vc")
public class IssuedCredential {

    @Embedded
    private final AuditMetadata auditMetadata = new AuditMetadata();

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Random uuid with '_' separators, written into the credential as system_uuid.
     */
    @NotNull
    @Column(unique = true)
    private String systemUuid;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "person_id")
    private Person person;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "template_id")
    private VcTemplate template;

    @NotNull
    @Enumerated(EnumType.STRING)
    private IssuedCredentialStatus status;

    @Nullable
    private String cid;

    /**
     * Field values as sent to the wallet sandbox.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, String> issuedData;

    private String benefitLevel;

    @Nullable
    private Instant issuedAt;

    @Nullable
    private Instant expiredAt;

    /**
     * Records the claim of the holder. Status handling is left to the state machine.
     */
    public void markClaimed(String cid, Instant claimedAt) {
        this.cid = cid;
        this.issuedAt = claimedAt;
        log.info("Credential {} claimed with cid {}", this.id, cid);
    }

    public void markExpired(Instant expiredAt) {
        this.expiredAt = expiredAt;
    }

    public void changeStatus(IssuedCredentialStatus status) {
        this.status = status;
    }

    public boolean isRevocableUpstream() {
        return this.status == IssuedCredentialStatus.ISSUED && this.cid != null;
    }
}

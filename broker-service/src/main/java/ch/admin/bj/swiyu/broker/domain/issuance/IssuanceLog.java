/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.issuance;

import ch.admin.bj.swiyu.broker.domain.AuditMetadata;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;

/**
 * Audit trail of one issuance transaction on the wallet sandbox, one per {@link IssuedCredential}.
 */
@Entity
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA
@AllArgsConstructor // test data
@EntityListeners(AuditingEntityListener.class)
@Table(name = "issuance_log")
public class IssuanceLog {

    @Embedded
    private final AuditMetadata auditMetadata = new AuditMetadata();

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Correlation id handed out by the wallet sandbox.
     */
    @NotNull
    @Column(unique = true)
    private String transactionId;

    @NotNull
    @Enumerated(EnumType.STRING)
    private IssuanceLogStatus status;

    @NotNull
    private Instant expiresAt;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "issued_vc_id", unique = true)
    private IssuedCredential issuedCredential;

    public boolean hasExpirationTimeStampPassed(Instant now) {
        return now.isAfter(this.expiresAt);
    }

    public void changeStatus(IssuanceLogStatus status) {
        this.status = status;
    }
}

/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.verification;

import ch.admin.bj.swiyu.broker.domain.AuditMetadata;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.UUID;

/**
 * Long-lived verification QR code. Every scan spawns a new one-shot {@link VerificationLog}
 * carrying a copy of the session metadata.
 */
@Entity
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA
@AllArgsConstructor // test data
@EntityListeners(AuditingEntityListener.class)
@Table(name = "batch_verification_session")
public class BatchVerificationSession {

    @Embedded
    private final AuditMetadata auditMetadata = new AuditMetadata();

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(unique = true)
    private UUID uuid;

    private String verifierInfo;

    private String verifierBranch;

    private String verificationReason;

    private String notes;

    @NotNull
    @Enumerated(EnumType.STRING)
    private BatchVerificationStatus status;

    @NotNull
    private Instant expiresAt;

    public boolean hasExpirationTimeStampPassed(Instant now) {
        return now.isAfter(this.expiresAt);
    }

    public void changeStatus(BatchVerificationStatus status) {
        this.status = status;
    }
}

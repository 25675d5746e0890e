/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.domain.verification;

import ch.admin.bj.swiyu.broker.domain.AuditMetadata;
import jakarta.annotation.Nullable;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.Map;

/**
 * One verification attempt on the verifier sandbox, either standalone or spawned by a batch session scan.
 */
@Entity
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA
@AllArgsConstructor // test data
@EntityListeners(AuditingEntityListener.class)
@Table(name = "verification_log")
public class VerificationLog {

    @Embedded
    private final AuditMetadata auditMetadata = new AuditMetadata();

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(unique = true)
    private String transactionId;

    @Nullable
    private Boolean verifyResult;

    @Nullable
    private String resultDescription;

    /**
     * Verifier response as received, kept for manual audit.
     */
    @Nullable
    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> returnedData;

    private String verifierInfo;

    private String verifierBranch;

    private String verificationReason;

    private String notes;

    @NotNull
    @Enumerated(EnumType.STRING)
    private VerificationStatus status;

    @NotNull
    private Instant expiresAt;

    /**
     * Only set while status is SUCCESS.
     */
    @Nullable
    private Long verifiedPersonId;

    @Nullable
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "batch_verification_session_id")
    private BatchVerificationSession batchSession;

    public boolean hasExpirationTimeStampPassed(Instant now) {
        return now.isAfter(this.expiresAt);
    }

    public void changeStatus(VerificationStatus status) {
        this.status = status;
    }

    public void recordResult(Boolean verifyResult, String resultDescription, Map<String, Object> returnedData) {
        this.verifyResult = verifyResult;
        this.resultDescription = resultDescription;
        this.returnedData = returnedData;
    }

    public void linkPerson(Long personId) {
        this.verifiedPersonId = personId;
    }
}

package com.aiinpocket.rewards.model.entity;

import com.aiinpocket.rewards.model.enums.TransferKind;
import com.aiinpocket.rewards.model.enums.TransferStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 帳本轉帳紀錄（只新增不修改）。
 * 來源或目的使用者為 null 時代表系統帳戶（挑戰託管 / 平台金庫）。
 * 使用者餘額 = 目的為該使用者的金額總和 − 來源為該使用者的金額總和（僅計 COMPLETED）。
 */
@Entity
@Table(name = "ledger_transfer", uniqueConstraints = {
        @UniqueConstraint(name = "uk_ledger_idempotency_key", columnNames = {"idempotency_key"})
}, indexes = {
        @Index(name = "idx_ledger_destination_kind", columnList = "destination_user_id, kind"),
        @Index(name = "idx_ledger_source", columnList = "source_user_id"),
        @Index(name = "idx_ledger_challenge", columnList = "challenge_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerTransfer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "challenge_id")
    private Challenge challenge;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "source_user_id")
    private AppUser sourceUser;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "destination_user_id")
    private AppUser destinationUser;

    /** 轉帳金額（恆為正數，方向由來源 / 目的決定） */
    @Column(nullable = false)
    private Long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransferKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TransferStatus status = TransferStatus.COMPLETED;

    /** 同一筆業務動作只會產生一筆轉帳，例如 award:participant:42 */
    @Column(name = "idempotency_key", nullable = false, length = 120)
    private String idempotencyKey;

    @Column(name = "reference_json", length = 1000)
    private String referenceJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}

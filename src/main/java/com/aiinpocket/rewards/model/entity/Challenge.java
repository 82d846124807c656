package com.aiinpocket.rewards.model.entity;

import com.aiinpocket.rewards.model.enums.ChallengeStatus;
import com.aiinpocket.rewards.model.enums.ChallengeType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 挑戰 Entity。
 * 建立者設定目標與獎金，啟用時依參加上限預留點數，
 * 參加者完成後由結算引擎從預留中發放獎金。
 *
 * <p>{@code configJson} 依 {@link #type} 對應一種設定結構，離開 DRAFT 之前必須通過驗證，
 * 啟用後不可再修改。
 */
@Entity
@Table(name = "challenge", indexes = {
        @Index(name = "idx_challenge_creator_status", columnList = "creator_id, status"),
        @Index(name = "idx_challenge_status_dates", columnList = "status, start_date, end_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Challenge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "creator_id", nullable = false)
    private AppUser creator;

    @Column(nullable = false, length = 200)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "challenge_type", nullable = false, length = 20)
    private ChallengeType type;

    /** 類型專屬設定（JSON） */
    @Column(name = "config_json", nullable = false, length = 4000)
    private String configJson;

    /** 完成獎金 */
    @Column(name = "prize_amount", nullable = false)
    @Builder.Default
    private Long prizeAmount = 0L;

    /** 完成加碼（與獎金一起發放） */
    @Column(name = "bonus_amount", nullable = false)
    @Builder.Default
    private Long bonusAmount = 0L;

    /** 參加人數上限（null 表示不限，預留金以預設人數估算） */
    @Column(name = "max_participants")
    private Integer maxParticipants;

    /** 加入時是否直接成為 ACTIVE（否則為 INVITED，需接受邀請） */
    @Column(name = "auto_accept", nullable = false)
    @Builder.Default
    private boolean autoAccept = true;

    @Column(name = "start_date")
    private Instant startDate;

    @Column(name = "end_date", nullable = false)
    private Instant endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ChallengeStatus status = ChallengeStatus.DRAFT;

    /** 啟用時預留的點數（只計算一次） */
    @Column(name = "reserved_amount", nullable = false)
    @Builder.Default
    private Long reservedAmount = 0L;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public long totalReward() {
        return prizeAmount + (bonusAmount != null ? bonusAmount : 0L);
    }

    /** 時間窗 [start, end) 是否包含指定時間 */
    public boolean isWithinWindow(Instant at) {
        return startDate != null && !at.isBefore(startDate) && at.isBefore(endDate);
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}

package com.aiinpocket.rewards.model.entity;

import com.aiinpocket.rewards.model.enums.ParticipantStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 挑戰參加者 Entity。
 * {@code progressJson} 保存最後一次驗證的進度快照（依挑戰類型而定），
 * {@code prizeAwarded} 在結算前恆為 0，只有 COMPLETED 的參加者才會大於 0。
 */
@Entity
@Table(name = "challenge_participant", uniqueConstraints = {
        @UniqueConstraint(name = "uk_participant_challenge_user", columnNames = {"challenge_id", "user_id"})
}, indexes = {
        @Index(name = "idx_participant_user_status", columnList = "user_id, status"),
        @Index(name = "idx_participant_challenge_status", columnList = "challenge_id, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChallengeParticipant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "challenge_id", nullable = false)
    private Challenge challenge;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private AppUser user;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ParticipantStatus status = ParticipantStatus.ACTIVE;

    /** 最後一次驗證的進度（JSON） */
    @Column(name = "progress_json", length = 4000)
    private String progressJson;

    @Column(name = "progress_percentage", nullable = false)
    @Builder.Default
    private Double progressPercentage = 0.0;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private Instant joinedAt;

    /** 開始計算進度的時間（接受邀請或直接加入時設定） */
    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "last_validated_at")
    private Instant lastValidatedAt;

    @Column(name = "prize_awarded", nullable = false)
    @Builder.Default
    private Long prizeAwarded = 0L;

    @PrePersist
    protected void onCreate() {
        if (this.joinedAt == null) {
            this.joinedAt = Instant.now();
        }
    }
}

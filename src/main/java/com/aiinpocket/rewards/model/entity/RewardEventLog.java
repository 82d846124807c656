package com.aiinpocket.rewards.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 獎勵事件紀錄（挑戰完成、等級變動、每週發放）。
 * 交易提交後寫入，作為通知與徽章服務讀取的收件匣。
 */
@Entity
@Table(name = "reward_event_log", indexes = {
        @Index(name = "idx_reward_event_user_seen", columnList = "user_id, seen")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RewardEventLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private AppUser user;

    @Column(name = "event_type", nullable = false, length = 30)
    private String eventType;

    @Column(name = "event_data", length = 1000)
    private String eventData;

    @Column(nullable = false)
    @Builder.Default
    private boolean seen = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}

package com.aiinpocket.rewards.model.entity;

import com.aiinpocket.rewards.model.enums.TierChangeDirection;
import com.aiinpocket.rewards.model.enums.TierKind;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 等級變動歷史。保存變動前後的等級與當下指標，用來追溯升降級的原因。
 */
@Entity
@Table(name = "promotion_history", indexes = {
        @Index(name = "idx_promotion_user_time", columnList = "user_id, promoted_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PromotionHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private AppUser user;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TierKind kind;

    @Column(name = "block_id")
    private Long blockId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "previous_tier_id")
    private TierDefinition previousTier;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "new_tier_id", nullable = false)
    private TierDefinition newTier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TierChangeDirection direction;

    @Column(name = "metrics_json", length = 1000)
    private String metricsJson;

    @Column(name = "promoted_at", nullable = false, updatable = false)
    private Instant promotedAt;

    @PrePersist
    protected void onCreate() {
        if (this.promotedAt == null) {
            this.promotedAt = Instant.now();
        }
    }
}

package com.aiinpocket.rewards.model.entity;

import com.aiinpocket.rewards.model.enums.PayoutStatus;
import com.aiinpocket.rewards.model.enums.TierKind;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 創作者 / 教師等級的每週發放紀錄。
 * (使用者, 種類, 週起始日) 唯一，重複執行同一週不會重複發放。
 */
@Entity
@Table(name = "weekly_payout", uniqueConstraints = {
        @UniqueConstraint(name = "uk_weekly_payout", columnNames = {"user_id", "kind", "week_start"})
}, indexes = {
        @Index(name = "idx_weekly_payout_week_status", columnList = "week_start, status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WeeklyPayout {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private AppUser user;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TierKind kind;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tier_id", nullable = false)
    private TierDefinition tier;

    @Column(name = "week_start", nullable = false)
    private LocalDate weekStart;

    @Column(name = "week_end", nullable = false)
    private LocalDate weekEnd;

    @Column(name = "base_amount", nullable = false)
    private Long baseAmount;

    @Column(name = "bonus_amount", nullable = false)
    @Builder.Default
    private Long bonusAmount = 0L;

    @Column(name = "total_amount", nullable = false)
    private Long totalAmount;

    /** 發放當下的指標（活躍人數等），下週計算成長加成時使用 */
    @Column(name = "metrics_json", length = 1000)
    private String metricsJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private PayoutStatus status = PayoutStatus.PENDING;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}

package com.aiinpocket.rewards.model.entity;

import com.aiinpocket.rewards.model.enums.TierKind;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 使用者目前的等級紀錄。
 * USER_TOPIC 以 blockId 區分範圍，CREATOR / TEACHER 的 blockId 為 null。
 * 每個 (使用者, 種類, 範圍) 只有一筆。
 */
@Entity
@Table(name = "tier_record", uniqueConstraints = {
        @UniqueConstraint(name = "uk_tier_record_scope", columnNames = {"user_id", "kind", "block_id"})
}, indexes = {
        @Index(name = "idx_tier_record_kind", columnList = "kind, current_tier_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TierRecord {

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

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "current_tier_id", nullable = false)
    private TierDefinition currentTier;

    /** 計算等級用的指標值（鞏固度百分比或活躍人數） */
    @Column(name = "metric_value", nullable = false)
    @Builder.Default
    private Double metricValue = 0.0;

    /** 計算當下的指標快照（JSON） */
    @Column(name = "metrics_json", length = 1000)
    private String metricsJson;

    /** 取得目前等級的時間 */
    @Column(name = "achieved_at", nullable = false)
    private Instant achievedAt;

    @Column(name = "last_calculated_at", nullable = false)
    private Instant lastCalculatedAt;
}

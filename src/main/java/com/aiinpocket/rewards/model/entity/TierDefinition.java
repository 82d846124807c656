package com.aiinpocket.rewards.model.entity;

import com.aiinpocket.rewards.model.enums.TierKind;
import jakarta.persistence.*;
import lombok.*;

/**
 * 等級定義。同一種類的等級依 {@code levelOrder} 排成階梯，
 * 門檻 [minThreshold, maxThreshold] 為閉區間，maxThreshold 為 null 表示沒有上限。
 */
@Entity
@Table(name = "tier_definition", uniqueConstraints = {
        @UniqueConstraint(name = "uk_tier_kind_name", columnNames = {"kind", "name"}),
        @UniqueConstraint(name = "uk_tier_kind_order", columnNames = {"kind", "level_order"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TierDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TierKind kind;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(name = "level_order", nullable = false)
    private Integer levelOrder;

    @Column(name = "min_threshold", nullable = false)
    private Integer minThreshold;

    @Column(name = "max_threshold")
    private Integer maxThreshold;

    /** 每週發放點數（使用者等級為 0） */
    @Column(name = "weekly_payout", nullable = false)
    @Builder.Default
    private Long weeklyPayout = 0L;

    @Column(length = 300)
    private String description;

    /** 等級權益（JSON） */
    @Column(name = "benefits_json", length = 1000)
    private String benefitsJson;

    public boolean matches(long metric) {
        return metric >= minThreshold && (maxThreshold == null || metric <= maxThreshold);
    }
}

package com.aiinpocket.rewards.model.dto;

import com.aiinpocket.rewards.model.entity.TierDefinition;
import com.aiinpocket.rewards.model.enums.TierChangeDirection;

/**
 * 重新計算等級的結果。changed 為 false 時 direction 為 null。
 */
public record TierChangeResult(
        boolean changed,
        TierDefinition previousTier,
        TierDefinition currentTier,
        TierChangeDirection direction,
        double metricValue
) {

    public static TierChangeResult unchanged(TierDefinition tier, double metricValue) {
        return new TierChangeResult(false, tier, tier, null, metricValue);
    }
}

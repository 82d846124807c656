package com.aiinpocket.rewards.model.event;

import com.aiinpocket.rewards.model.enums.TierChangeDirection;
import com.aiinpocket.rewards.model.enums.TierKind;

import java.util.Map;

/**
 * 使用者等級變動（含第一次取得等級）。previousTierId 在第一次取得時為 null。
 */
public record TierChanged(
        Long userId,
        TierKind kind,
        Long blockId,
        Long previousTierId,
        Long newTierId,
        String newTierName,
        TierChangeDirection direction,
        Map<String, Object> metrics
) {}

package com.aiinpocket.rewards.model.config;

import com.aiinpocket.rewards.model.enums.ChallengeType;

import java.util.List;

import static com.aiinpocket.rewards.model.config.ConfigChecks.require;

/**
 * 鞏固度挑戰：題組（可限定主題）的答對率達到目標百分比。
 */
public record ConsolidationConfig(
        Long targetBlockId,
        Double targetPercentage,
        List<String> specificTopics
) implements ChallengeConfig {

    public ConsolidationConfig {
        if (targetPercentage == null) targetPercentage = 85.0;
        specificTopics = specificTopics != null ? List.copyOf(specificTopics) : List.of();
    }

    @Override
    public ChallengeType type() {
        return ChallengeType.CONSOLIDATION;
    }

    @Override
    public void validate() {
        require(targetBlockId != null, "target_block_id 為必填");
        require(targetPercentage > 0 && targetPercentage <= 100, "target_percentage 必須介於 0（不含）到 100");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitConsolidation(this);
    }
}

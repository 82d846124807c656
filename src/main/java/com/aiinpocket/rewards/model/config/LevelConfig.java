package com.aiinpocket.rewards.model.config;

import com.aiinpocket.rewards.model.enums.ChallengeType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.aiinpocket.rewards.model.config.ConfigChecks.require;
import static com.aiinpocket.rewards.model.config.ConfigChecks.requirePercentage;

/**
 * 等級挑戰：在每個題組達到指定的主題等級。
 *
 * @param targetLevels             題組 ID → 目標等級順位（對應 USER_TOPIC 等級的 levelOrder）
 * @param minConsolidationPerBlock 每個題組最低鞏固度（預設 75）
 */
public record LevelConfig(
        Map<Long, Integer> targetLevels,
        Double minConsolidationPerBlock
) implements ChallengeConfig {

    public LevelConfig {
        targetLevels = targetLevels != null ? Collections.unmodifiableMap(new LinkedHashMap<>(targetLevels)) : Map.of();
        if (minConsolidationPerBlock == null) minConsolidationPerBlock = 75.0;
    }

    @Override
    public ChallengeType type() {
        return ChallengeType.LEVEL;
    }

    @Override
    public void validate() {
        require(!targetLevels.isEmpty(), "target_levels 不可為空");
        targetLevels.forEach((blockId, level) ->
                require(blockId != null && level != null && level >= 1,
                        "target_levels 的目標等級必須至少為 1: block " + blockId));
        requirePercentage(minConsolidationPerBlock, "min_consolidation_per_block");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLevel(this);
    }
}

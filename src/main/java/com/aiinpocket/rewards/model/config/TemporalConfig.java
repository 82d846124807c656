package com.aiinpocket.rewards.model.config;

import com.aiinpocket.rewards.model.enums.ChallengeType;
import com.aiinpocket.rewards.model.enums.ObjectiveType;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.aiinpocket.rewards.model.config.ConfigChecks.require;

/**
 * 限時活動挑戰：多個子目標的加權平均進度達到 100% 即完成。
 * 子目標各自轉成一般挑戰設定驗證，權重未指定時為 1。
 */
public record TemporalConfig(
        List<Objective> objectives,
        Map<String, Double> weights
) implements ChallengeConfig {

    public TemporalConfig {
        objectives = objectives != null ? List.copyOf(objectives) : List.of();
        weights = weights != null ? Collections.unmodifiableMap(new LinkedHashMap<>(weights)) : Map.of();
    }

    public double weightOf(String objectiveId) {
        Double weight = weights.get(objectiveId);
        return weight != null ? weight : 1.0;
    }

    @Override
    public ChallengeType type() {
        return ChallengeType.TEMPORAL;
    }

    @Override
    public void validate() {
        require(!objectives.isEmpty(), "objectives 不可為空");
        Set<String> ids = new HashSet<>();
        double totalWeight = 0;
        for (Objective objective : objectives) {
            require(objective.id() != null && !objective.id().isBlank(), "objective 缺少 id");
            require(ids.add(objective.id()), "objective id 重複: " + objective.id());
            require(objective.type() != null, "objective " + objective.id() + " 缺少 type");
            double weight = weightOf(objective.id());
            require(weight >= 0, "objective " + objective.id() + " 的權重不可為負數");
            totalWeight += weight;
            objective.toConfig().validate();
        }
        require(totalWeight > 0, "weights 總和必須大於 0");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitTemporal(this);
    }

    /**
     * 子目標。依 type 只會用到部分欄位，其餘留空。
     */
    public record Objective(
            String id,
            ObjectiveType type,
            List<Long> targetBlocks,
            Double minScore,
            Integer targetWins,
            List<String> gameModes,
            Integer targetDays,
            Integer minSessions,
            Integer minMinutes,
            Integer minQuestions,
            Map<Long, Integer> targetLevels,
            Long targetBlockId,
            Double targetPercentage
    ) {

        /** 轉成對應類型的挑戰設定（子目標不限制嘗試次數與勝率） */
        public ChallengeConfig toConfig() {
            return switch (type) {
                case BLOCKS_COMPLETED -> new MarathonConfig(targetBlocks, minScore, 999, false);
                case GAMES_WON -> new CompetitionConfig(targetWins, gameModes, 0.0, 0.0);
                case STREAK_MAINTAINED -> new StreakConfig(targetDays, minSessions, minMinutes, minQuestions, null);
                case LEVELS_REACHED -> new LevelConfig(targetLevels, null);
                case CONSOLIDATION_REACHED -> new ConsolidationConfig(targetBlockId, targetPercentage, null);
            };
        }
    }
}

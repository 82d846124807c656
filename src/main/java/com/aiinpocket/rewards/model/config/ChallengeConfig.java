package com.aiinpocket.rewards.model.config;

import com.aiinpocket.rewards.model.enums.ChallengeType;

/**
 * 挑戰設定。每種挑戰類型對應一個 record，透過 {@link Visitor} 分派到對應的驗證器。
 */
public interface ChallengeConfig {

    ChallengeType type();

    /** 檢查欄位是否合法，不合法時拋出 ChallengeConfigException */
    void validate();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {

        R visitMarathon(MarathonConfig config);

        R visitLevel(LevelConfig config);

        R visitStreak(StreakConfig config);

        R visitCompetition(CompetitionConfig config);

        R visitConsolidation(ConsolidationConfig config);

        R visitTemporal(TemporalConfig config);
    }
}

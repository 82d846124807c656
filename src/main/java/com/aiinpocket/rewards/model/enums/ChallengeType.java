package com.aiinpocket.rewards.model.enums;

import com.aiinpocket.rewards.model.config.ChallengeConfig;
import com.aiinpocket.rewards.model.config.CompetitionConfig;
import com.aiinpocket.rewards.model.config.ConsolidationConfig;
import com.aiinpocket.rewards.model.config.LevelConfig;
import com.aiinpocket.rewards.model.config.MarathonConfig;
import com.aiinpocket.rewards.model.config.StreakConfig;
import com.aiinpocket.rewards.model.config.TemporalConfig;
import com.aiinpocket.rewards.model.progress.ChallengeProgress;
import com.aiinpocket.rewards.model.progress.CompetitionProgress;
import com.aiinpocket.rewards.model.progress.ConsolidationProgress;
import com.aiinpocket.rewards.model.progress.LevelProgress;
import com.aiinpocket.rewards.model.progress.MarathonProgress;
import com.aiinpocket.rewards.model.progress.StreakProgress;
import com.aiinpocket.rewards.model.progress.TemporalProgress;

/**
 * 挑戰類型。每種類型有各自的設定結構與進度結構。
 */
public enum ChallengeType {
    /** 在多個題組中達到分數門檻 */
    MARATHON(MarathonConfig.class, MarathonProgress.class),
    /** 在指定題組達到目標等級 */
    LEVEL(LevelConfig.class, LevelProgress.class),
    /** 連續多日達成每日活動量 */
    STREAK(StreakConfig.class, StreakProgress.class),
    /** 多人對戰勝場 */
    COMPETITION(CompetitionConfig.class, CompetitionProgress.class),
    /** 題組答題正確率 */
    CONSOLIDATION(ConsolidationConfig.class, ConsolidationProgress.class),
    /** 多個子目標的加權組合 */
    TEMPORAL(TemporalConfig.class, TemporalProgress.class);

    private final Class<? extends ChallengeConfig> configClass;
    private final Class<? extends ChallengeProgress> progressClass;

    ChallengeType(Class<? extends ChallengeConfig> configClass, Class<? extends ChallengeProgress> progressClass) {
        this.configClass = configClass;
        this.progressClass = progressClass;
    }

    public Class<? extends ChallengeConfig> configClass() {
        return configClass;
    }

    public Class<? extends ChallengeProgress> progressClass() {
        return progressClass;
    }
}

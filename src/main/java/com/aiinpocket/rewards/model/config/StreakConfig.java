package com.aiinpocket.rewards.model.config;

import com.aiinpocket.rewards.model.enums.ChallengeType;

import static com.aiinpocket.rewards.model.config.ConfigChecks.require;

/**
 * 連續天數挑戰。每天需同時達到場次、分鐘數、答題數三項門檻才算一天，
 * 允許中間缺一天的次數由 allowedBreaks 控制。
 */
public record StreakConfig(
        Integer requiredDays,
        Integer minDailySessions,
        Integer minDailyTimeMinutes,
        Integer minDailyQuestions,
        Integer allowedBreaks
) implements ChallengeConfig {

    public StreakConfig {
        if (requiredDays == null) requiredDays = 7;
        if (minDailySessions == null) minDailySessions = 1;
        if (minDailyTimeMinutes == null) minDailyTimeMinutes = 15;
        if (minDailyQuestions == null) minDailyQuestions = 10;
        if (allowedBreaks == null) allowedBreaks = 1;
    }

    @Override
    public ChallengeType type() {
        return ChallengeType.STREAK;
    }

    @Override
    public void validate() {
        require(requiredDays >= 1, "required_days 必須至少為 1");
        require(minDailySessions >= 0, "min_daily_sessions 不可為負數");
        require(minDailyTimeMinutes >= 0, "min_daily_time_minutes 不可為負數");
        require(minDailyQuestions >= 0, "min_daily_questions 不可為負數");
        require(allowedBreaks >= 0, "allowed_breaks 不可為負數");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStreak(this);
    }
}

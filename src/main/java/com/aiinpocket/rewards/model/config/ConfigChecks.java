package com.aiinpocket.rewards.model.config;

import com.aiinpocket.rewards.exception.ChallengeConfigException;

final class ConfigChecks {

    private ConfigChecks() {}

    static void require(boolean condition, String message) {
        if (!condition) {
            throw new ChallengeConfigException(message);
        }
    }

    static void requirePercentage(Double value, String field) {
        require(value != null && value >= 0 && value <= 100, field + " 必須介於 0 到 100");
    }

    static void requireRatio(Double value, String field) {
        require(value != null && value >= 0 && value <= 1, field + " 必須介於 0 到 1");
    }
}

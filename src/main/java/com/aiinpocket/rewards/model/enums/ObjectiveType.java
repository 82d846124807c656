package com.aiinpocket.rewards.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 綜合（TEMPORAL）挑戰的子目標種類，每種對應一個既有的挑戰驗證器。
 */
public enum ObjectiveType {
    BLOCKS_COMPLETED("blocks_completed"),
    LEVELS_REACHED("levels_reached"),
    STREAK_MAINTAINED("streak_maintained"),
    GAMES_WON("games_won"),
    CONSOLIDATION_REACHED("consolidation_reached");

    private final String key;

    ObjectiveType(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static ObjectiveType fromKey(String key) {
        return Arrays.stream(values())
                .filter(t -> t.key.equalsIgnoreCase(key) || t.name().equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的子目標種類: " + key));
    }
}

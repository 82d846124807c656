package com.aiinpocket.rewards.model.enums;

public enum GameSessionStatus {
    WAITING,
    IN_PROGRESS,
    COMPLETED,
    ABANDONED
}

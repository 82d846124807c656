package com.aiinpocket.rewards.model.enums;

public enum PayoutStatus {
    PENDING,
    PAID,
    FAILED,
    CANCELLED
}

package com.aiinpocket.rewards.model.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * 參加者狀態機。
 * ACTIVE 是唯一可以進入 COMPLETED / FAILED / ABANDONED 的狀態，COMPLETED 為終態。
 */
public enum ParticipantStatus {
    INVITED,
    ACTIVE,
    COMPLETED,
    FAILED,
    ABANDONED;

    public Set<ParticipantStatus> allowedTargets() {
        return switch (this) {
            case INVITED -> EnumSet.of(ACTIVE);
            case ACTIVE -> EnumSet.of(COMPLETED, FAILED, ABANDONED);
            case COMPLETED, FAILED, ABANDONED -> EnumSet.noneOf(ParticipantStatus.class);
        };
    }

    public boolean canTransitionTo(ParticipantStatus target) {
        return allowedTargets().contains(target);
    }
}

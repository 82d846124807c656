package com.aiinpocket.rewards.model.dto;

/** 題組的已完成遊戲次數與最佳分數 */
public record BlockAttempts(int attempts, double bestScore) {

    public static final BlockAttempts NONE = new BlockAttempts(0, 0);
}

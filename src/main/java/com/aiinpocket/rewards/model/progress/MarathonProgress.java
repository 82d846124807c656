package com.aiinpocket.rewards.model.progress;

import java.util.List;

public record MarathonProgress(
        int completedBlocks,
        int totalBlocks,
        double averageScore,
        int totalAttempts,
        List<BlockProgress> blocks,
        double progressPercentage
) implements ChallengeProgress {

    public record BlockProgress(Long blockId, int attempts, double bestScore, boolean completed) {}
}

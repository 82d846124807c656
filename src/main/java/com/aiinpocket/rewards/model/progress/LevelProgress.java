package com.aiinpocket.rewards.model.progress;

import java.util.List;

public record LevelProgress(
        int levelsAchieved,
        int totalTargets,
        List<BlockLevel> blocks,
        double progressPercentage
) implements ChallengeProgress {

    public record BlockLevel(Long blockId, int currentLevel, int targetLevel, double consolidation, boolean achieved) {}
}

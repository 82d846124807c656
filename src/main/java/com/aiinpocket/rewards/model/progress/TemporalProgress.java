package com.aiinpocket.rewards.model.progress;

import java.util.Map;

public record TemporalProgress(
        double averageProgress,
        Map<String, ObjectiveResult> objectives,
        double progressPercentage
) implements ChallengeProgress {

    public record ObjectiveResult(double progress, double weight, boolean completed) {}
}

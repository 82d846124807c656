package com.aiinpocket.rewards.model.progress;

public record ConsolidationProgress(
        double currentPercentage,
        double targetPercentage,
        long totalAnswers,
        long correctAnswers,
        long topicsCovered,
        double progressPercentage
) implements ChallengeProgress {}

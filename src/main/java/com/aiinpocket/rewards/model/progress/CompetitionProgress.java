package com.aiinpocket.rewards.model.progress;

public record CompetitionProgress(
        int wins,
        int requiredWins,
        int totalGames,
        double winRate,
        double accuracy,
        double progressPercentage
) implements ChallengeProgress {}

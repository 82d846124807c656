package com.aiinpocket.rewards.model.progress;

import java.time.LocalDate;
import java.util.List;

public record StreakProgress(
        int currentStreak,
        int maxStreak,
        int requiredDays,
        int breaksUsed,
        int allowedBreaks,
        List<DayProgress> days,
        double progressPercentage
) implements ChallengeProgress {

    public record DayProgress(LocalDate date, int sessions, long minutes, int questions, boolean completed) {}
}

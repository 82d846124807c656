package com.aiinpocket.rewards.service.validation;

import com.aiinpocket.rewards.config.RewardEngineProperties;
import com.aiinpocket.rewards.model.config.StreakConfig;
import com.aiinpocket.rewards.model.dto.DailyActivity;
import com.aiinpocket.rewards.model.dto.ValidationContext;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.progress.StreakProgress;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * 連續天數挑戰驗證。
 *
 * <p>只有同時達到三項每日門檻的日子才列入計算（未達標的日子直接略過）。
 * 與上一個達標日相隔 1 天時連續天數 +1；相隔 2 天且還有可用的中斷次數時，
 * 消耗一次中斷並 +1（缺的那天本身不計入）；其他情況重新從 1 開始。
 */
@Component
@RequiredArgsConstructor
public class StreakValidator implements ChallengeValidator<StreakConfig, StreakProgress> {

    private final ActivityReadModel readModel;
    private final RewardEngineProperties properties;

    @Override
    public ValidationResult<StreakProgress> validate(ValidationContext context, StreakConfig config) {
        List<DailyActivity> activity = readModel.dailyActivity(context.userId(), context.since(), properties.zone());

        int currentStreak = 0;
        int maxStreak = 0;
        int breaksUsed = 0;
        LocalDate lastCounted = null;
        List<StreakProgress.DayProgress> days = new ArrayList<>(activity.size());

        for (DailyActivity day : activity) {
            boolean dayCompleted = day.sessions() >= config.minDailySessions()
                    && day.minutes() >= config.minDailyTimeMinutes()
                    && day.questions() >= config.minDailyQuestions();
            days.add(new StreakProgress.DayProgress(day.date(), day.sessions(), Math.round(day.minutes()),
                    day.questions(), dayCompleted));
            if (!dayCompleted) {
                continue;
            }

            if (lastCounted == null) {
                currentStreak = 1;
            } else {
                long gap = ChronoUnit.DAYS.between(lastCounted, day.date());
                if (gap == 1) {
                    currentStreak++;
                } else if (gap == 2 && breaksUsed < config.allowedBreaks()) {
                    breaksUsed++;
                    currentStreak++;
                } else {
                    currentStreak = 1;
                }
            }
            maxStreak = Math.max(maxStreak, currentStreak);
            lastCounted = day.date();
        }

        double percentage = Math.min(maxStreak * 100.0 / config.requiredDays(), 100.0);
        return new ValidationResult<>(maxStreak >= config.requiredDays(), new StreakProgress(
                currentStreak, maxStreak, config.requiredDays(), breaksUsed, config.allowedBreaks(), days, percentage));
    }
}

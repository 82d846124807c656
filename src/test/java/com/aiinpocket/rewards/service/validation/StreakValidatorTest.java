package com.aiinpocket.rewards.service.validation;

import com.aiinpocket.rewards.config.RewardEngineProperties;
import com.aiinpocket.rewards.model.config.StreakConfig;
import com.aiinpocket.rewards.model.dto.DailyActivity;
import com.aiinpocket.rewards.model.dto.ValidationContext;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.progress.StreakProgress;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StreakValidatorTest {

    private static final LocalDate DAY_1 = LocalDate.of(2026, 3, 2);

    @Mock
    private ActivityReadModel readModel;

    private StreakValidator validator;
    private ValidationContext context;

    @BeforeEach
    void setUp() {
        RewardEngineProperties properties = new RewardEngineProperties(null, null, null, null, null, null);
        validator = new StreakValidator(readModel, properties);
        Instant since = Instant.parse("2026-03-01T00:00:00Z");
        context = new ValidationContext(10L, 20L, 7L, since, Instant.parse("2026-03-10T00:00:00Z"));
    }

    private static DailyActivity active(LocalDate date) {
        return new DailyActivity(date, 2, 30, 12);
    }

    private void givenDays(DailyActivity... days) {
        when(readModel.dailyActivity(eq(7L), any(), any())).thenReturn(List.of(days));
    }

    @Test
    @DisplayName("中斷一天且還有中斷次數時，連續天數延續")
    void gapWithinBreakBudgetKeepsStreak() {
        givenDays(active(DAY_1), active(DAY_1.plusDays(1)), active(DAY_1.plusDays(3)));

        ValidationResult<StreakProgress> result = validator.validate(context, new StreakConfig(7, 1, 15, 10, 1));

        assertThat(result.progress().maxStreak()).isEqualTo(3);
        assertThat(result.progress().breaksUsed()).isEqualTo(1);
        assertThat(result.completed()).isFalse();
    }

    @Test
    @DisplayName("沒有中斷次數時，中斷一天重新計算")
    void gapWithoutBreakBudgetResetsStreak() {
        givenDays(active(DAY_1), active(DAY_1.plusDays(1)), active(DAY_1.plusDays(3)));

        ValidationResult<StreakProgress> result = validator.validate(context, new StreakConfig(7, 1, 15, 10, 0));

        assertThat(result.progress().maxStreak()).isEqualTo(2);
        assertThat(result.progress().currentStreak()).isEqualTo(1);
        assertThat(result.progress().breaksUsed()).isZero();
    }

    @Test
    @DisplayName("未達每日門檻的日子不列入，也不算中斷")
    void incompleteDayIsSkipped() {
        givenDays(active(DAY_1),
                new DailyActivity(DAY_1.plusDays(1), 1, 5, 3),
                active(DAY_1.plusDays(2)));

        ValidationResult<StreakProgress> result = validator.validate(context, new StreakConfig(3, 1, 15, 10, 1));

        assertThat(result.progress().maxStreak()).isEqualTo(2);
        assertThat(result.progress().breaksUsed()).isEqualTo(1);
        assertThat(result.progress().days()).hasSize(3);
        assertThat(result.progress().days().get(1).completed()).isFalse();
    }

    @Test
    void completesWhenRequiredDaysReached() {
        givenDays(active(DAY_1), active(DAY_1.plusDays(1)), active(DAY_1.plusDays(2)));

        ValidationResult<StreakProgress> result = validator.validate(context, new StreakConfig(3, 1, 15, 10, 0));

        assertThat(result.completed()).isTrue();
        assertThat(result.progressPercentage()).isEqualTo(100.0);
    }

    @Test
    void noActivityMeansZeroProgress() {
        givenDays();

        ValidationResult<StreakProgress> result = validator.validate(context, new StreakConfig(null, null, null, null, null));

        assertThat(result.completed()).isFalse();
        assertThat(result.progress().maxStreak()).isZero();
        assertThat(result.progressPercentage()).isZero();
    }
}

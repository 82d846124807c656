package com.aiinpocket.rewards.service.validation;

import com.aiinpocket.rewards.model.config.LevelConfig;
import com.aiinpocket.rewards.model.dto.AnswerTally;
import com.aiinpocket.rewards.model.dto.ValidationContext;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.entity.TierDefinition;
import com.aiinpocket.rewards.model.enums.TierKind;
import com.aiinpocket.rewards.model.progress.LevelProgress;
import com.aiinpocket.rewards.service.level.TierLadder;
import com.aiinpocket.rewards.service.level.TierLadderService;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LevelValidatorTest {

    private static final Instant SINCE = Instant.parse("2026-03-01T00:00:00Z");
    private static final ValidationContext CONTEXT =
            new ValidationContext(1L, 2L, 3L, SINCE, Instant.parse("2026-03-05T00:00:00Z"));

    @Mock private ActivityReadModel readModel;
    @Mock private TierLadderService ladderService;

    @InjectMocks
    private LevelValidator validator;

    private static TierDefinition tier(long id, String name, int order, int min, int max) {
        return TierDefinition.builder().id(id).kind(TierKind.USER_TOPIC).name(name)
                .levelOrder(order).minThreshold(min).maxThreshold(max).build();
    }

    @BeforeEach
    void setUp() {
        when(ladderService.ladder(TierKind.USER_TOPIC)).thenReturn(TierLadder.of(TierKind.USER_TOPIC, List.of(
                tier(1, "Aprendiz", 1, 0, 25),
                tier(2, "Explorador", 2, 26, 50),
                tier(3, "Estratega", 3, 51, 80),
                tier(4, "Sabio", 4, 81, 95),
                tier(5, "Gran Maestro", 5, 96, 100))));
    }

    private void accuracy(long blockId, long correctOutOfHundred) {
        when(readModel.answerTally(3L, blockId, SINCE, List.of()))
                .thenReturn(new AnswerTally(100, correctOutOfHundred, 1));
    }

    private static LevelConfig targets(long blockA, int levelA, long blockB, int levelB) {
        Map<Long, Integer> targets = new LinkedHashMap<>();
        targets.put(blockA, levelA);
        targets.put(blockB, levelB);
        return new LevelConfig(targets, 75.0);
    }

    @Test
    void levelReachedButConsolidationBelowFloorDoesNotCount() {
        accuracy(10L, 85);
        accuracy(20L, 40);

        ValidationResult<LevelProgress> result = validator.validate(CONTEXT, targets(10L, 3, 20L, 2));

        assertThat(result.completed()).isFalse();
        assertThat(result.progressPercentage()).isEqualTo(50.0);
        assertThat(result.progress().blocks())
                .extracting(LevelProgress.BlockLevel::blockId, LevelProgress.BlockLevel::currentLevel,
                        LevelProgress.BlockLevel::achieved)
                .containsExactly(tuple(10L, 4, true), tuple(20L, 2, false));
    }

    @Test
    void consolidationAboveFloorButLevelBelowTargetDoesNotCount() {
        accuracy(10L, 80);
        accuracy(20L, 97);

        ValidationResult<LevelProgress> result = validator.validate(CONTEXT, targets(10L, 4, 20L, 5));

        assertThat(result.completed()).isFalse();
        assertThat(result.progress().levelsAchieved()).isEqualTo(1);
        assertThat(result.progress().blocks())
                .extracting(LevelProgress.BlockLevel::currentLevel)
                .containsExactly(3, 5);
    }

    @Test
    void allTargetsReachedCompletes() {
        accuracy(10L, 90);
        accuracy(20L, 96);

        ValidationResult<LevelProgress> result = validator.validate(CONTEXT, targets(10L, 4, 20L, 5));

        assertThat(result.completed()).isTrue();
        assertThat(result.progressPercentage()).isEqualTo(100.0);
    }
}

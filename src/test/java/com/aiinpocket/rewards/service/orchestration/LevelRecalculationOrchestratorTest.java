package com.aiinpocket.rewards.service.orchestration;

import com.aiinpocket.rewards.config.RewardEngineProperties;
import com.aiinpocket.rewards.model.dto.LevelRunSummary;
import com.aiinpocket.rewards.repository.AppUserRepository;
import com.aiinpocket.rewards.service.level.LevelCalculatorService;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LevelRecalculationOrchestratorTest {

    @Mock private ActivityReadModel readModel;
    @Mock private AppUserRepository userRepo;
    @Mock private LevelCalculatorService levelCalculator;

    private LevelRecalculationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new LevelRecalculationOrchestrator(readModel, userRepo, levelCalculator,
                new RewardEngineProperties(null, null, null, null, null, null));
    }

    @Test
    void changesAreCountedAndErrorsIsolated() {
        when(readModel.recentlyActiveUserIds(any())).thenReturn(Set.of(1L, 2L, 3L));
        when(userRepo.findCreatorAndTeacherIds()).thenReturn(List.of());
        when(levelCalculator.recalculateAll(1L)).thenReturn(2);
        when(levelCalculator.recalculateAll(2L)).thenThrow(new IllegalStateException("等級階梯未設定: CREATOR"));
        when(levelCalculator.recalculateAll(3L)).thenReturn(0);

        LevelRunSummary summary = orchestrator.runLevelRecalculation();

        assertThat(summary).isEqualTo(new LevelRunSummary(3, 2, 1));
    }

    @Test
    void idleCreatorIsStillRecalculated() {
        when(readModel.recentlyActiveUserIds(any())).thenReturn(Set.of());
        when(userRepo.findCreatorAndTeacherIds()).thenReturn(List.of(7L));
        when(levelCalculator.recalculateAll(7L)).thenReturn(1);

        LevelRunSummary summary = orchestrator.runLevelRecalculation();

        assertThat(summary).isEqualTo(new LevelRunSummary(1, 1, 0));
        verify(levelCalculator).recalculateAll(7L);
    }

    @Test
    void activeCreatorIsRecalculatedOnce() {
        when(readModel.recentlyActiveUserIds(any())).thenReturn(Set.of(7L));
        when(userRepo.findCreatorAndTeacherIds()).thenReturn(List.of(7L));

        assertThat(orchestrator.runLevelRecalculation().usersProcessed()).isEqualTo(1);
        verify(levelCalculator, times(1)).recalculateAll(7L);
    }
}

package com.aiinpocket.rewards.service.validation;

import com.aiinpocket.rewards.model.config.LevelConfig;
import com.aiinpocket.rewards.model.dto.ValidationContext;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.enums.TierKind;
import com.aiinpocket.rewards.model.progress.LevelProgress;
import com.aiinpocket.rewards.service.level.TierLadder;
import com.aiinpocket.rewards.service.level.TierLadderService;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 等級挑戰驗證。
 * 每個題組以加入後的答對率對照 USER_TOPIC 等級階梯，
 * 等級順位達到目標且答對率達到最低鞏固度才算達成，所有題組都達成才完成。
 */
@Component
@RequiredArgsConstructor
public class LevelValidator implements ChallengeValidator<LevelConfig, LevelProgress> {

    private final ActivityReadModel readModel;
    private final TierLadderService ladderService;

    @Override
    public ValidationResult<LevelProgress> validate(ValidationContext context, LevelConfig config) {
        TierLadder ladder = ladderService.ladder(TierKind.USER_TOPIC);
        List<LevelProgress.BlockLevel> blocks = new ArrayList<>();
        int achieved = 0;

        for (Map.Entry<Long, Integer> target : config.targetLevels().entrySet()) {
            double consolidation = readModel
                    .answerTally(context.userId(), target.getKey(), context.since(), List.of())
                    .percentage();
            int currentLevel = ladder.tierFor(consolidation).getLevelOrder();
            boolean reached = currentLevel >= target.getValue()
                    && consolidation >= config.minConsolidationPerBlock();
            if (reached) {
                achieved++;
            }
            blocks.add(new LevelProgress.BlockLevel(target.getKey(), currentLevel, target.getValue(),
                    consolidation, reached));
        }

        int totalTargets = config.targetLevels().size();
        double percentage = totalTargets > 0 ? achieved * 100.0 / totalTargets : 0;
        return new ValidationResult<>(totalTargets > 0 && achieved == totalTargets,
                new LevelProgress(achieved, totalTargets, blocks, percentage));
    }
}

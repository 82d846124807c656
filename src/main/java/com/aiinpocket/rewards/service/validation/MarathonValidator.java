package com.aiinpocket.rewards.service.validation;

import com.aiinpocket.rewards.model.config.MarathonConfig;
import com.aiinpocket.rewards.model.dto.BlockAttempts;
import com.aiinpocket.rewards.model.dto.ValidationContext;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.progress.MarathonProgress;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 馬拉松挑戰驗證。
 * 題組通過 = 最佳分數達門檻且嘗試次數未超過上限。
 * 全部通過模式要求每個題組都通過；否則至少一個題組通過，
 * 且所有指定題組的平均最佳分數（未嘗試的題組以 0 計）達門檻。
 */
@Component
@RequiredArgsConstructor
public class MarathonValidator implements ChallengeValidator<MarathonConfig, MarathonProgress> {

    private final ActivityReadModel readModel;

    @Override
    public ValidationResult<MarathonProgress> validate(ValidationContext context, MarathonConfig config) {
        List<Long> required = config.requiredBlocks();
        List<MarathonProgress.BlockProgress> blocks = new ArrayList<>(required.size());
        int completedBlocks = 0;
        int totalAttempts = 0;
        double totalScore = 0;

        for (Long blockId : required) {
            BlockAttempts attempts = readModel.blockAttempts(context.userId(), blockId, context.since());
            totalAttempts += attempts.attempts();
            boolean passed = attempts.attempts() > 0
                    && attempts.bestScore() >= config.minAverageScore()
                    && attempts.attempts() <= config.maxAttemptsPerBlock();
            if (attempts.attempts() > 0) {
                totalScore += attempts.bestScore();
            }
            if (passed) {
                completedBlocks++;
            }
            blocks.add(new MarathonProgress.BlockProgress(blockId, attempts.attempts(), attempts.bestScore(), passed));
        }

        int totalBlocks = required.size();
        double averageScore = totalBlocks > 0 ? totalScore / totalBlocks : 0;
        boolean completed = config.mustCompleteAll()
                ? completedBlocks == totalBlocks
                : completedBlocks > 0 && averageScore >= config.minAverageScore();
        double percentage = totalBlocks > 0 ? completedBlocks * 100.0 / totalBlocks : 0;

        return new ValidationResult<>(completed, new MarathonProgress(
                completedBlocks, totalBlocks, averageScore, totalAttempts, blocks, percentage));
    }
}

package com.aiinpocket.rewards.service.validation;

import com.aiinpocket.rewards.model.config.ChallengeConfig;
import com.aiinpocket.rewards.model.config.TemporalConfig;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.progress.TemporalProgress;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * 限時活動挑戰驗證。
 * 每個子目標的進度以 100 為上限乘上權重後加總，再除以總權重；平均達 100 才完成。
 * 子目標由呼叫端提供的驗證函式處理（即一般挑戰的分派器）。
 */
@Component
public class TemporalValidator {

    public ValidationResult<TemporalProgress> validate(TemporalConfig config,
                                                       Function<ChallengeConfig, ValidationResult<?>> objectiveValidator) {
        Map<String, TemporalProgress.ObjectiveResult> results = new LinkedHashMap<>();
        double weightedProgress = 0;
        double totalWeight = 0;

        for (TemporalConfig.Objective objective : config.objectives()) {
            double weight = config.weightOf(objective.id());
            double progress = Math.min(objectiveValidator.apply(objective.toConfig()).progressPercentage(), 100.0);
            weightedProgress += progress * weight;
            totalWeight += weight;
            results.put(objective.id(), new TemporalProgress.ObjectiveResult(progress, weight, progress >= 100.0));
        }

        double average = totalWeight > 0 ? weightedProgress / totalWeight : 0;
        return new ValidationResult<>(average >= 100.0,
                new TemporalProgress(average, results, Math.min(average, 100.0)));
    }
}

package com.aiinpocket.rewards.service.validation;

import com.aiinpocket.rewards.model.config.ConsolidationConfig;
import com.aiinpocket.rewards.model.dto.AnswerTally;
import com.aiinpocket.rewards.model.dto.ValidationContext;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.progress.ConsolidationProgress;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConsolidationValidator implements ChallengeValidator<ConsolidationConfig, ConsolidationProgress> {

    private final ActivityReadModel readModel;

    @Override
    public ValidationResult<ConsolidationProgress> validate(ValidationContext context, ConsolidationConfig config) {
        AnswerTally tally = readModel.answerTally(context.userId(), config.targetBlockId(), context.since(),
                config.specificTopics());
        double current = tally.percentage();
        double percentage = Math.min(current * 100.0 / config.targetPercentage(), 100.0);

        return new ValidationResult<>(current >= config.targetPercentage(), new ConsolidationProgress(
                current, config.targetPercentage(), tally.totalAnswers(), tally.correctAnswers(),
                tally.topicsCovered(), percentage));
    }
}

package com.aiinpocket.rewards.service.validation;

import com.aiinpocket.rewards.model.config.ChallengeConfig;
import com.aiinpocket.rewards.model.config.CompetitionConfig;
import com.aiinpocket.rewards.model.config.ConsolidationConfig;
import com.aiinpocket.rewards.model.config.LevelConfig;
import com.aiinpocket.rewards.model.config.MarathonConfig;
import com.aiinpocket.rewards.model.config.StreakConfig;
import com.aiinpocket.rewards.model.config.TemporalConfig;
import com.aiinpocket.rewards.model.dto.ValidationContext;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.entity.ChallengeParticipant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * 挑戰驗證分派器。依設定的型別交給對應的驗證器，限時活動的子目標也經由這裡分派。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChallengeValidationService {

    private final MarathonValidator marathonValidator;
    private final LevelValidator levelValidator;
    private final StreakValidator streakValidator;
    private final CompetitionValidator competitionValidator;
    private final ConsolidationValidator consolidationValidator;
    private final TemporalValidator temporalValidator;
    private final ChallengeJsonCodec codec;

    /**
     * 驗證參加者目前的進度。參加者必須已載入所屬挑戰。
     */
    public ValidationResult<?> validate(ChallengeParticipant participant, Instant now) {
        var challenge = participant.getChallenge();
        ChallengeConfig config = codec.readValidConfig(challenge.getType(), challenge.getConfigJson());
        Instant since = participant.getStartedAt() != null ? participant.getStartedAt() : participant.getJoinedAt();
        ValidationContext context = new ValidationContext(
                participant.getId(), challenge.getId(), participant.getUser().getId(), since, now);
        ValidationResult<?> result = validate(context, config);
        log.debug("[挑戰驗證] 參加者 {} ({}) 進度 {}%, 完成={}",
                participant.getId(), challenge.getType(), result.progressPercentage(), result.completed());
        return result;
    }

    public ValidationResult<?> validate(ValidationContext context, ChallengeConfig config) {
        return config.accept(new ChallengeConfig.Visitor<ValidationResult<?>>() {
            @Override
            public ValidationResult<?> visitMarathon(MarathonConfig c) {
                return marathonValidator.validate(context, c);
            }

            @Override
            public ValidationResult<?> visitLevel(LevelConfig c) {
                return levelValidator.validate(context, c);
            }

            @Override
            public ValidationResult<?> visitStreak(StreakConfig c) {
                return streakValidator.validate(context, c);
            }

            @Override
            public ValidationResult<?> visitCompetition(CompetitionConfig c) {
                return competitionValidator.validate(context, c);
            }

            @Override
            public ValidationResult<?> visitConsolidation(ConsolidationConfig c) {
                return consolidationValidator.validate(context, c);
            }

            @Override
            public ValidationResult<?> visitTemporal(TemporalConfig c) {
                return temporalValidator.validate(c, objective -> validate(context, objective));
            }
        });
    }
}

package com.aiinpocket.rewards.service.validation;

import com.aiinpocket.rewards.model.config.CompetitionConfig;
import com.aiinpocket.rewards.model.dto.SessionOutcome;
import com.aiinpocket.rewards.model.dto.ValidationContext;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.progress.CompetitionProgress;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 對戰挑戰驗證。分數等於該場最高分即為勝場（並列也算）。
 * 勝場數、勝率、答對率三項都達標才完成。
 */
@Component
@RequiredArgsConstructor
public class CompetitionValidator implements ChallengeValidator<CompetitionConfig, CompetitionProgress> {

    private final ActivityReadModel readModel;

    @Override
    public ValidationResult<CompetitionProgress> validate(ValidationContext context, CompetitionConfig config) {
        List<SessionOutcome> games = readModel.multiplayerOutcomes(context.userId(), config.gameModes(), context.since());

        int totalGames = games.size();
        int wins = (int) games.stream().filter(SessionOutcome::won).count();
        long totalQuestions = games.stream().mapToLong(SessionOutcome::totalQuestions).sum();
        long correctAnswers = games.stream().mapToLong(SessionOutcome::correctAnswers).sum();

        double winRate = totalGames > 0 ? (double) wins / totalGames : 0;
        double accuracy = totalQuestions > 0 ? (double) correctAnswers / totalQuestions : 0;
        boolean completed = wins >= config.requiredWins()
                && winRate >= config.minWinRate()
                && accuracy >= config.minAccuracy();
        double percentage = Math.min(wins * 100.0 / config.requiredWins(), 100.0);

        return new ValidationResult<>(completed, new CompetitionProgress(
                wins, config.requiredWins(), totalGames, winRate, accuracy, percentage));
    }
}

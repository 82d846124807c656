package com.aiinpocket.rewards.model.config;

import com.aiinpocket.rewards.model.enums.ChallengeType;

import java.util.List;

import static com.aiinpocket.rewards.model.config.ConfigChecks.require;
import static com.aiinpocket.rewards.model.config.ConfigChecks.requireRatio;

/**
 * 對戰挑戰：在指定模式的多人遊戲中贏得足夠場次。
 * 同分並列最高分時所有並列者都算勝場。
 */
public record CompetitionConfig(
        Integer requiredWins,
        List<String> gameModes,
        Double minWinRate,
        Double minAccuracy
) implements ChallengeConfig {

    public static final List<String> DEFAULT_GAME_MODES = List.of("duelo", "trivial");

    public CompetitionConfig {
        if (requiredWins == null) requiredWins = 5;
        gameModes = gameModes != null && !gameModes.isEmpty() ? List.copyOf(gameModes) : DEFAULT_GAME_MODES;
        if (minWinRate == null) minWinRate = 0.6;
        if (minAccuracy == null) minAccuracy = 0.7;
    }

    @Override
    public ChallengeType type() {
        return ChallengeType.COMPETITION;
    }

    @Override
    public void validate() {
        require(requiredWins >= 1, "required_wins 必須至少為 1");
        requireRatio(minWinRate, "min_win_rate");
        requireRatio(minAccuracy, "min_accuracy");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCompetition(this);
    }
}

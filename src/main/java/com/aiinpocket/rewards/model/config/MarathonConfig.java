package com.aiinpocket.rewards.model.config;

import com.aiinpocket.rewards.model.enums.ChallengeType;

import java.util.HashSet;
import java.util.List;

import static com.aiinpocket.rewards.model.config.ConfigChecks.require;
import static com.aiinpocket.rewards.model.config.ConfigChecks.requirePercentage;

/**
 * 馬拉松挑戰：在指定題組中取得足夠分數。
 *
 * @param requiredBlocks      必須挑戰的題組
 * @param minAverageScore     單一題組通過的最佳分數門檻（預設 70）
 * @param maxAttemptsPerBlock 單一題組最多嘗試次數（預設 3）
 * @param mustCompleteAll     是否所有題組都必須通過（預設 true）
 */
public record MarathonConfig(
        List<Long> requiredBlocks,
        Double minAverageScore,
        Integer maxAttemptsPerBlock,
        Boolean mustCompleteAll
) implements ChallengeConfig {

    public MarathonConfig {
        requiredBlocks = requiredBlocks != null ? List.copyOf(requiredBlocks) : List.of();
        if (minAverageScore == null) minAverageScore = 70.0;
        if (maxAttemptsPerBlock == null) maxAttemptsPerBlock = 3;
        if (mustCompleteAll == null) mustCompleteAll = true;
    }

    @Override
    public ChallengeType type() {
        return ChallengeType.MARATHON;
    }

    @Override
    public void validate() {
        require(!requiredBlocks.isEmpty(), "required_blocks 不可為空");
        require(new HashSet<>(requiredBlocks).size() == requiredBlocks.size(), "required_blocks 不可重複");
        requirePercentage(minAverageScore, "min_average_score");
        require(maxAttemptsPerBlock >= 1, "max_attempts_per_block 必須至少為 1");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitMarathon(this);
    }
}

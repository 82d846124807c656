package com.aiinpocket.rewards.model.dto;

/**
 * 使用者在一場多人遊戲中的成績。maxScore 為該場所有玩家的最高分。
 */
public record SessionOutcome(Long sessionId, String gameType, int score, int maxScore,
                             int correctAnswers, int totalQuestions) {

    /** 同分並列最高分也算勝場 */
    public boolean won() {
        return score >= maxScore;
    }
}

package com.aiinpocket.rewards.model.dto;

/**
 * 作答統計。percentage 為答對率（0–100），沒有作答時為 0。
 */
public record AnswerTally(long totalAnswers, long correctAnswers, long topicsCovered) {

    public static final AnswerTally EMPTY = new AnswerTally(0, 0, 0);

    public double percentage() {
        return totalAnswers > 0 ? correctAnswers * 100.0 / totalAnswers : 0.0;
    }
}

package com.aiinpocket.rewards.model.dto;

import com.aiinpocket.rewards.model.progress.ChallengeProgress;

public record ValidationResult<P extends ChallengeProgress>(boolean completed, P progress) {

    public double progressPercentage() {
        return progress.progressPercentage();
    }
}

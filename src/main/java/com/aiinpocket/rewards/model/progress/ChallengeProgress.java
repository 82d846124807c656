package com.aiinpocket.rewards.model.progress;

/**
 * 驗證後的進度快照，序列化後存入 challenge_participant.progress_json。
 */
public interface ChallengeProgress {

    /** 0 到 100 的完成百分比 */
    double progressPercentage();
}

package com.aiinpocket.rewards.model.event;

/**
 * 參加者完成挑戰且獎金已入帳。
 */
public record ChallengeCompleted(Long participantId, Long userId, Long challengeId, long totalAwarded) {}

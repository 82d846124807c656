package com.aiinpocket.rewards.model.dto;

import java.time.Instant;

/**
 * 驗證單一參加者所需的資訊。只計算 {@code since} 之後的活動。
 */
public record ValidationContext(Long participantId, Long challengeId, Long userId, Instant since, Instant now) {}

package com.aiinpocket.rewards.model.dto;

import com.aiinpocket.rewards.model.config.ChallengeConfig;

import java.time.Instant;

/**
 * 建立挑戰草稿的輸入。startDate 為 null 時於啟用當下開始。
 */
public record ChallengeDraft(
        Long creatorId,
        String title,
        ChallengeConfig config,
        long prizeAmount,
        long bonusAmount,
        Integer maxParticipants,
        boolean autoAccept,
        Instant startDate,
        Instant endDate
) {}

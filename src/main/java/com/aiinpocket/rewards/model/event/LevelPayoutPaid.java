package com.aiinpocket.rewards.model.event;

import com.aiinpocket.rewards.model.enums.TierKind;

import java.time.LocalDate;

public record LevelPayoutPaid(Long payoutId, Long userId, TierKind kind, LocalDate weekStart,
                              long baseAmount, long bonusAmount) {}

package com.aiinpocket.rewards.model.dto;

import com.aiinpocket.rewards.model.entity.Challenge;
import com.aiinpocket.rewards.model.enums.TransferKind;

import java.util.Map;

/**
 * 轉帳請求。sourceUserId / destinationUserId 為 null 代表系統帳戶。
 */
public record TransferRequest(
        Long sourceUserId,
        Long destinationUserId,
        long amount,
        TransferKind kind,
        Challenge challenge,
        String idempotencyKey,
        Map<String, ?> reference
) {

    public static TransferRequest credit(Long userId, long amount, TransferKind kind, Challenge challenge,
                                         String idempotencyKey, Map<String, ?> reference) {
        return new TransferRequest(null, userId, amount, kind, challenge, idempotencyKey, reference);
    }

    public static TransferRequest debit(Long userId, long amount, TransferKind kind, Challenge challenge,
                                        String idempotencyKey, Map<String, ?> reference) {
        return new TransferRequest(userId, null, amount, kind, challenge, idempotencyKey, reference);
    }
}

package com.aiinpocket.rewards.model.dto;

/**
 * 餘額對帳結果。ledgerBalance 為已完成轉帳的淨額。
 */
public record ReconciliationResult(Long userId, long balance, long ledgerBalance) {

    public boolean consistent() {
        return balance == ledgerBalance;
    }

    public long difference() {
        return balance - ledgerBalance;
    }
}

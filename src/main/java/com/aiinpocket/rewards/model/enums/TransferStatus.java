package com.aiinpocket.rewards.model.enums;

/**
 * 帳本轉帳狀態。只有 COMPLETED 的轉帳會計入餘額對帳。
 */
public enum TransferStatus {
    PENDING,
    COMPLETED,
    FAILED,
    REVERSED
}

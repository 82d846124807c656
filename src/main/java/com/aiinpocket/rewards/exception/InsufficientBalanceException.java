package com.aiinpocket.rewards.exception;

import lombok.Getter;

/**
 * 扣款金額超過使用者目前餘額。
 */
@Getter
public class InsufficientBalanceException extends RuntimeException {

    private final Long userId;
    private final long balance;
    private final long requested;

    public InsufficientBalanceException(Long userId, long balance, long requested) {
        super("餘額不足: userId=" + userId + ", balance=" + balance + ", requested=" + requested);
        this.userId = userId;
        this.balance = balance;
        this.requested = requested;
    }
}

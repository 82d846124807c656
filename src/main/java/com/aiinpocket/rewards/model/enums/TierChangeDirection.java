package com.aiinpocket.rewards.model.enums;

/**
 * 等級變動方向。INITIAL 表示第一次取得等級（沒有前一個等級）。
 */
public enum TierChangeDirection {
    INITIAL,
    PROMOTION,
    DEMOTION
}

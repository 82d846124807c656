package com.aiinpocket.rewards.model.enums;

/**
 * 等級階梯種類。
 * USER_TOPIC 以區塊鞏固度計算（每個區塊一筆紀錄），CREATOR / TEACHER 以近期活躍人數計算。
 */
public enum TierKind {
    USER_TOPIC,
    CREATOR,
    TEACHER;

    public boolean isScoped() {
        return this == USER_TOPIC;
    }

    /** 只有創作者與教師等級有每週發放 */
    public boolean isPayable() {
        return this != USER_TOPIC;
    }
}

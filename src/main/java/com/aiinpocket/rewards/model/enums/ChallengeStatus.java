package com.aiinpocket.rewards.model.enums;

/**
 * 挑戰生命週期狀態。
 *
 * <ul>
 *   <li>DRAFT — 草稿（設定尚可修改，尚未預留獎金）</li>
 *   <li>ACTIVE — 進行中（已從建立者餘額預留獎金，參加者可加入）</li>
 *   <li>PAUSED — 暫停（不進行驗證，恢復後不重複預留）</li>
 *   <li>COMPLETED — 時間窗結束，未使用的預留已退還</li>
 *   <li>CANCELLED — 建立者取消，未使用的預留已退還</li>
 * </ul>
 */
public enum ChallengeStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    COMPLETED,
    CANCELLED
}

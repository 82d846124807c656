package com.aiinpocket.rewards.model.enums;

/**
 * 帳本轉帳種類。
 *
 * <ul>
 *   <li>RESERVE — 挑戰啟用時從建立者扣除預留金</li>
 *   <li>AWARD — 參加者完成挑戰的獎金（獎金 + 加碼）</li>
 *   <li>REFUND — 挑戰取消或到期時退還未使用的預留金</li>
 *   <li>BONUS — 額外加給（每週等級加成、管理員補發）</li>
 *   <li>PENALTY — 管理員扣點</li>
 *   <li>LEVEL_PAYOUT — 創作者 / 教師等級的每週基本發放</li>
 * </ul>
 */
public enum TransferKind {
    RESERVE,
    AWARD,
    REFUND,
    BONUS,
    PENALTY,
    LEVEL_PAYOUT
}

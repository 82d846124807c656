package com.aiinpocket.rewards.service.level;

import com.aiinpocket.rewards.config.RewardEngineProperties;
import com.aiinpocket.rewards.config.RewardEngineProperties.PayoutParams;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 每週發放的加成計算。
 *
 * <p>創作者：活躍人數比上週成長，每滿一級（預設 10%）加基本發放的 10%，最多加到與基本發放相同；
 * 另依活躍人數里程碑加固定點數。
 * 教師：學生數達上週的 1.1 倍以上加基本發放的 15%；另依學生平均鞏固度加固定點數。
 * 上週沒有發放紀錄（或人數為 0）時不計成長加成。
 */
@Component
@RequiredArgsConstructor
public class PayoutBonusCalculator {

    private final RewardEngineProperties properties;

    public long creatorBonus(long basePayout, long activeUsers, long previousActiveUsers) {
        PayoutParams params = properties.payouts();
        long bonus = 0;
        if (previousActiveUsers > 0 && activeUsers > previousActiveUsers) {
            double growthPct = (activeUsers - previousActiveUsers) * 100.0 / previousActiveUsers;
            if (growthPct >= params.creatorGrowthStepPct()) {
                long steps = (long) Math.floor(growthPct / params.creatorGrowthStepPct());
                bonus = Math.min(Math.round(basePayout * params.creatorGrowthStepBonus() * steps), basePayout);
            }
        }
        return bonus + PayoutParams.bonusFor(params.creatorMilestones(), activeUsers);
    }

    public long teacherBonus(long basePayout, long activeStudents, long previousActiveStudents,
                             double studentAverageConsolidation) {
        PayoutParams params = properties.payouts();
        long bonus = 0;
        if (previousActiveStudents > 0 && activeStudents >= previousActiveStudents) {
            double retention = (double) activeStudents / previousActiveStudents;
            if (retention >= params.teacherRetentionRatio()) {
                bonus = Math.round(basePayout * params.teacherRetentionBonus());
            }
        }
        return bonus + PayoutParams.bonusFor(params.teacherEngagementBonuses(), studentAverageConsolidation);
    }
}

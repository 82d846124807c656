package com.aiinpocket.rewards.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.util.List;

/**
 * 獎勵引擎設定（application.yml 的 rewards 區段）。未設定的欄位使用預設值。
 */
@ConfigurationProperties(prefix = "rewards")
public record RewardEngineProperties(
        String zoneId,
        SettlementParams settlement,
        ValidationParams validation,
        LevelParams levels,
        PayoutParams payouts,
        ScheduleParams schedule
) {

    public RewardEngineProperties {
        if (zoneId == null) zoneId = "Europe/Madrid";
        if (settlement == null) settlement = new SettlementParams(null);
        if (validation == null) validation = new ValidationParams(null, null, null, null);
        if (levels == null) levels = new LevelParams(null, null, null);
        if (payouts == null) payouts = new PayoutParams(null, null, null, null, null, null);
        if (schedule == null) schedule = new ScheduleParams(null, null, null, null);
    }

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }

    /**
     * @param defaultReserveParticipants 挑戰未設定人數上限時，預留金以此人數估算
     */
    public record SettlementParams(Integer defaultReserveParticipants) {
        public SettlementParams {
            if (defaultReserveParticipants == null) defaultReserveParticipants = 100;
        }
    }

    /**
     * @param corePoolSize              驗證執行緒池核心數
     * @param maxPoolSize               驗證執行緒池最大數
     * @param queueCapacity             排隊上限
     * @param participantTimeoutSeconds 單一參加者的驗證時限
     */
    public record ValidationParams(Integer corePoolSize, Integer maxPoolSize, Integer queueCapacity,
                                   Long participantTimeoutSeconds) {
        public ValidationParams {
            if (corePoolSize == null) corePoolSize = 4;
            if (maxPoolSize == null) maxPoolSize = 8;
            if (queueCapacity == null) queueCapacity = 500;
            if (participantTimeoutSeconds == null) participantTimeoutSeconds = 30L;
        }
    }

    /**
     * @param activeWindowDays          計算創作者 / 教師活躍人數的回溯天數
     * @param recentActivityHours       每日重算等級時，視為「近期活躍」的時數
     * @param studentConsolidationDays  教師加成中學生平均鞏固度的回溯天數
     */
    public record LevelParams(Integer activeWindowDays, Integer recentActivityHours,
                              Integer studentConsolidationDays) {
        public LevelParams {
            if (activeWindowDays == null) activeWindowDays = 30;
            if (recentActivityHours == null) recentActivityHours = 24;
            if (studentConsolidationDays == null) studentConsolidationDays = 7;
        }
    }

    /**
     * 每週發放的加成規則。
     *
     * @param creatorGrowthStepPct      創作者活躍人數每成長多少百分比算一級
     * @param creatorGrowthStepBonus    每一級加成（基本發放的比例），總加成不超過基本發放
     * @param creatorMilestones         活躍人數里程碑加成（取符合的最高門檻）
     * @param teacherRetentionRatio     教師學生數相對上週的比例門檻
     * @param teacherRetentionBonus     達到門檻的加成（基本發放的比例）
     * @param teacherEngagementBonuses  學生平均鞏固度加成（取符合的最高門檻）
     */
    public record PayoutParams(Double creatorGrowthStepPct, Double creatorGrowthStepBonus,
                               List<Threshold> creatorMilestones,
                               Double teacherRetentionRatio, Double teacherRetentionBonus,
                               List<Threshold> teacherEngagementBonuses) {
        public PayoutParams {
            if (creatorGrowthStepPct == null) creatorGrowthStepPct = 10.0;
            if (creatorGrowthStepBonus == null) creatorGrowthStepBonus = 0.1;
            if (creatorMilestones == null || creatorMilestones.isEmpty()) {
                creatorMilestones = List.of(new Threshold(500.0, 40L), new Threshold(100.0, 20L),
                        new Threshold(50.0, 10L));
            }
            if (teacherRetentionRatio == null) teacherRetentionRatio = 1.1;
            if (teacherRetentionBonus == null) teacherRetentionBonus = 0.15;
            if (teacherEngagementBonuses == null || teacherEngagementBonuses.isEmpty()) {
                teacherEngagementBonuses = List.of(new Threshold(80.0, 15L), new Threshold(70.0, 8L));
            }
        }

        /** 取 value 達到的最高門檻的加成，沒有達到任何門檻為 0 */
        public static long bonusFor(List<Threshold> thresholds, double value) {
            return thresholds.stream()
                    .filter(t -> value >= t.min())
                    .mapToLong(Threshold::bonus)
                    .max()
                    .orElse(0L);
        }
    }

    public record Threshold(Double min, Long bonus) {}

    /**
     * Quartz cron 表達式。
     */
    public record ScheduleParams(String validationCron, String levelRecalculationCron,
                                 String expiryCron, String weeklyPayoutCron) {
        public ScheduleParams {
            if (validationCron == null) validationCron = "0 */15 * * * ?";
            if (levelRecalculationCron == null) levelRecalculationCron = "0 30 3 * * ?";
            if (expiryCron == null) expiryCron = "0 5 * * * ?";
            if (weeklyPayoutCron == null) weeklyPayoutCron = "0 0 6 ? * MON";
        }
    }
}

package com.aiinpocket.rewards.job;

import com.aiinpocket.rewards.service.DistributedLockService;
import com.aiinpocket.rewards.service.level.LevelPayoutService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 創作者 / 教師等級每週發放排程任務（預設每週一早上）。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WeeklyPayoutJob extends QuartzJobBean {

    private final LevelPayoutService levelPayoutService;
    private final DistributedLockService lockService;

    /** Advisory lock ID: WeeklyPayoutJob 專用 */
    private static final long WEEKLY_PAYOUT_LOCK_ID = 2_100_004L;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        lockService.executeWithLock(WEEKLY_PAYOUT_LOCK_ID, "WeeklyPayoutJob", () -> {
            log.info("[每週發放排程] 開始執行");
            try {
                levelPayoutService.runWeeklyPayouts();
            } catch (Exception e) {
                log.error("[每週發放排程] 執行失敗: {}", e.getMessage(), e);
            }
        });
    }
}

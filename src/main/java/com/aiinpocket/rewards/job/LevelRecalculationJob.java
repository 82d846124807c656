package com.aiinpocket.rewards.job;

import com.aiinpocket.rewards.service.DistributedLockService;
import com.aiinpocket.rewards.service.orchestration.LevelRecalculationOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 每日等級重算排程任務。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LevelRecalculationJob extends QuartzJobBean {

    private final LevelRecalculationOrchestrator levelRecalculationOrchestrator;
    private final DistributedLockService lockService;

    /** Advisory lock ID: LevelRecalculationJob 專用 */
    private static final long LEVEL_RECALCULATION_LOCK_ID = 2_100_002L;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        lockService.executeWithLock(LEVEL_RECALCULATION_LOCK_ID, "LevelRecalculationJob", () -> {
            log.info("[等級重算排程] 開始執行");
            try {
                levelRecalculationOrchestrator.runLevelRecalculation();
            } catch (Exception e) {
                log.error("[等級重算排程] 執行失敗: {}", e.getMessage(), e);
            }
        });
    }
}

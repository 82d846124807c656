package com.aiinpocket.rewards.job;

import com.aiinpocket.rewards.service.DistributedLockService;
import com.aiinpocket.rewards.service.orchestration.ValidationOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 挑戰驗證排程任務（預設每 15 分鐘）。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChallengeValidationJob extends QuartzJobBean {

    private final ValidationOrchestrator validationOrchestrator;
    private final DistributedLockService lockService;

    /** Advisory lock ID: ChallengeValidationJob 專用 */
    private static final long CHALLENGE_VALIDATION_LOCK_ID = 2_100_001L;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        lockService.executeWithLock(CHALLENGE_VALIDATION_LOCK_ID, "ChallengeValidationJob", () -> {
            log.info("[挑戰驗證排程] 開始執行");
            try {
                validationOrchestrator.runValidation();
            } catch (Exception e) {
                log.error("[挑戰驗證排程] 執行失敗: {}", e.getMessage(), e);
            }
        });
    }
}

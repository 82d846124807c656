package com.aiinpocket.rewards.job;

import com.aiinpocket.rewards.service.DistributedLockService;
import com.aiinpocket.rewards.service.orchestration.ChallengeExpiryOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 挑戰到期排程任務（預設每小時）。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChallengeExpiryJob extends QuartzJobBean {

    private final ChallengeExpiryOrchestrator challengeExpiryOrchestrator;
    private final DistributedLockService lockService;

    /** Advisory lock ID: ChallengeExpiryJob 專用 */
    private static final long CHALLENGE_EXPIRY_LOCK_ID = 2_100_003L;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        lockService.executeWithLock(CHALLENGE_EXPIRY_LOCK_ID, "ChallengeExpiryJob", () -> {
            log.info("[挑戰到期排程] 開始執行");
            try {
                challengeExpiryOrchestrator.expireChallenges();
            } catch (Exception e) {
                log.error("[挑戰到期排程] 執行失敗: {}", e.getMessage(), e);
            }
        });
    }
}

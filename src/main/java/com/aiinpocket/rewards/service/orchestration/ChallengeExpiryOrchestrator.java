package com.aiinpocket.rewards.service.orchestration;

import com.aiinpocket.rewards.model.dto.ExpiryRunSummary;
import com.aiinpocket.rewards.model.enums.ChallengeStatus;
import com.aiinpocket.rewards.repository.ChallengeRepository;
import com.aiinpocket.rewards.service.settlement.SettlementService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * 結束已過期的挑戰，未完成的參加者標記失敗並退還剩餘預留。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChallengeExpiryOrchestrator {

    private static final List<ChallengeStatus> EXPIRABLE = List.of(ChallengeStatus.ACTIVE, ChallengeStatus.PAUSED);

    private final ChallengeRepository challengeRepo;
    private final SettlementService settlementService;

    public ExpiryRunSummary expireChallenges() {
        List<Long> expiredIds = challengeRepo.findExpiredIds(EXPIRABLE, Instant.now());
        if (expiredIds.isEmpty()) {
            log.debug("[挑戰到期] 沒有過期的挑戰");
            return new ExpiryRunSummary(0, 0, 0);
        }

        int expired = 0;
        long refunded = 0;
        int errors = 0;
        for (Long challengeId : expiredIds) {
            try {
                refunded += settlementService.expire(challengeId);
                expired++;
            } catch (Exception e) {
                errors++;
                log.error("[挑戰到期] 挑戰 {} 結束失敗: {}", challengeId, e.getMessage(), e);
            }
        }

        log.info("[挑戰到期] 結束 {} 個挑戰，退還 {} 點，錯誤 {} 個", expired, refunded, errors);
        return new ExpiryRunSummary(expired, refunded, errors);
    }
}

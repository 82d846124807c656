package com.aiinpocket.rewards.service.orchestration;

import com.aiinpocket.rewards.exception.ValidationTimeoutException;
import com.aiinpocket.rewards.model.dto.SettlementOutcome;
import com.aiinpocket.rewards.model.dto.ValidationResult;
import com.aiinpocket.rewards.model.entity.ChallengeParticipant;
import com.aiinpocket.rewards.model.enums.ParticipantStatus;
import com.aiinpocket.rewards.repository.ChallengeParticipantRepository;
import com.aiinpocket.rewards.service.settlement.SettlementService;
import com.aiinpocket.rewards.service.validation.ChallengeValidationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * 單一參加者的驗證流程：驗證 → 寫入進度 → 完成時結算。
 * 驗證本身不寫資料，進度與結算各自在 {@link SettlementService} 的交易中完成。
 * 驗證結束時已超過時限就直接放棄，不寫入任何資料，參加者維持 ACTIVE 等下一批次。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ParticipantValidationProcessor {

    private final ChallengeParticipantRepository participantRepo;
    private final ChallengeValidationService validationService;
    private final SettlementService settlementService;

    /**
     * @param now      批次的基準時間（驗證視窗的終點）
     * @param deadline 本參加者的處理時限，由工作執行緒開始處理時起算
     * @return 本次呼叫是否結算了這位參加者
     * @throws ValidationTimeoutException 驗證完成時已超過時限
     */
    public boolean process(Long participantId, Instant now, Instant deadline) {
        ChallengeParticipant participant = participantRepo.findWithChallengeById(participantId)
                .orElseThrow(() -> new IllegalArgumentException("參加者不存在: " + participantId));
        if (participant.getStatus() != ParticipantStatus.ACTIVE) {
            log.debug("[挑戰驗證] 參加者 {} 狀態為 {}，略過", participantId, participant.getStatus());
            return false;
        }

        ValidationResult<?> result = validationService.validate(participant, now);
        if (Instant.now().isAfter(deadline)) {
            throw new ValidationTimeoutException("參加者 " + participantId + " 驗證超過時限，放棄本次結果");
        }
        settlementService.recordProgress(participantId, result.progress(), now);
        if (!result.completed()) {
            log.debug("[挑戰驗證] 參加者 {} 進度 {}%", participantId, result.progressPercentage());
            return false;
        }

        SettlementOutcome outcome = settlementService.settleParticipant(participantId);
        return outcome.isSettled();
    }
}

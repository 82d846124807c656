package com.aiinpocket.rewards.service.event;

import com.aiinpocket.rewards.model.entity.RewardEventLog;
import com.aiinpocket.rewards.model.event.ChallengeCompleted;
import com.aiinpocket.rewards.model.event.LevelPayoutPaid;
import com.aiinpocket.rewards.model.event.TierChanged;
import com.aiinpocket.rewards.repository.AppUserRepository;
import com.aiinpocket.rewards.repository.RewardEventLogRepository;
import com.aiinpocket.rewards.service.validation.ChallengeJsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 結算交易提交後，把獎勵事件寫入 reward_event_log。
 * 交易回滾時不會收到事件，所以紀錄中只會有真正入帳的結果。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RewardEventRecorder {

    private final RewardEventLogRepository eventRepo;
    private final AppUserRepository userRepo;
    private final ChallengeJsonCodec codec;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onChallengeCompleted(ChallengeCompleted event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("challenge_id", event.challengeId());
        data.put("participant_id", event.participantId());
        data.put("total_awarded", event.totalAwarded());
        record(event.userId(), "CHALLENGE_COMPLETED", data);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onTierChanged(TierChanged event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("kind", event.kind().name());
        if (event.blockId() != null) {
            data.put("block_id", event.blockId());
        }
        data.put("previous_tier_id", event.previousTierId());
        data.put("new_tier_id", event.newTierId());
        data.put("new_tier", event.newTierName());
        data.put("direction", event.direction().name());
        record(event.userId(), "TIER_" + event.direction().name(), data);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void onLevelPayoutPaid(LevelPayoutPaid event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("payout_id", event.payoutId());
        data.put("kind", event.kind().name());
        data.put("week_start", event.weekStart().toString());
        data.put("base_amount", event.baseAmount());
        data.put("bonus_amount", event.bonusAmount());
        record(event.userId(), "LEVEL_PAYOUT", data);
    }

    private void record(Long userId, String eventType, Map<String, Object> data) {
        try {
            eventRepo.save(RewardEventLog.builder()
                    .user(userRepo.getReferenceById(userId))
                    .eventType(eventType)
                    .eventData(codec.writeMap(data))
                    .build());
            log.debug("[獎勵事件] 使用者 {} 記錄事件 {}", userId, eventType);
        } catch (Exception e) {
            // 入帳已提交，事件紀錄失敗不影響結算結果
            log.warn("[獎勵事件] 使用者 {} 的事件 {} 記錄失敗: {}", userId, eventType, e.getMessage());
        }
    }
}

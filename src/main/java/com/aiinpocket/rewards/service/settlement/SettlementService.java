package com.aiinpocket.rewards.service.settlement;

import com.aiinpocket.rewards.config.RewardEngineProperties;
import com.aiinpocket.rewards.exception.InvalidStateTransitionException;
import com.aiinpocket.rewards.model.dto.SettlementOutcome;
import com.aiinpocket.rewards.model.dto.TransferRequest;
import com.aiinpocket.rewards.model.entity.Challenge;
import com.aiinpocket.rewards.model.entity.ChallengeParticipant;
import com.aiinpocket.rewards.model.enums.ChallengeStatus;
import com.aiinpocket.rewards.model.enums.ParticipantStatus;
import com.aiinpocket.rewards.model.enums.TransferKind;
import com.aiinpocket.rewards.model.enums.TransferStatus;
import com.aiinpocket.rewards.model.event.ChallengeCompleted;
import com.aiinpocket.rewards.model.progress.ChallengeProgress;
import com.aiinpocket.rewards.repository.ChallengeParticipantRepository;
import com.aiinpocket.rewards.repository.ChallengeRepository;
import com.aiinpocket.rewards.repository.LedgerTransferRepository;
import com.aiinpocket.rewards.service.validation.ChallengeJsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 挑戰結算引擎。
 *
 * <p>所有狀態轉換都是「先搶再改」：以條件式 UPDATE 取得轉換權，受影響筆數為 0 代表
 * 已被其他交易處理，直接結束；取得轉換權後才寫入帳本。每個方法都是一個完整的交易，
 * 任何一步失敗都整筆回滾。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementService {

    private final ChallengeRepository challengeRepo;
    private final ChallengeParticipantRepository participantRepo;
    private final LedgerTransferRepository transferRepo;
    private final LedgerService ledgerService;
    private final ChallengeJsonCodec codec;
    private final ApplicationEventPublisher eventPublisher;
    private final RewardEngineProperties properties;

    /**
     * 結算完成挑戰的參加者：ACTIVE → COMPLETED，並從託管發放 獎金 + 加碼。
     * 同一位參加者同時被結算時只有一個呼叫會發放，其餘回傳 RACE_LOST。
     */
    @Transactional(timeout = 10)
    public SettlementOutcome settleParticipant(Long participantId) {
        Instant now = Instant.now();
        int claimed = participantRepo.transition(participantId, ParticipantStatus.ACTIVE,
                ParticipantStatus.COMPLETED, now);
        if (claimed == 0) {
            log.debug("[挑戰結算] 參加者 {} 已被其他程序結算或不在進行中，略過", participantId);
            return SettlementOutcome.raceLost(participantId);
        }

        ChallengeParticipant participant = participantRepo.findWithChallengeById(participantId)
                .orElseThrow(() -> new IllegalArgumentException("參加者不存在: " + participantId));
        Challenge challenge = participant.getChallenge();
        Long userId = participant.getUser().getId();
        long total = challenge.totalReward();

        if (total > 0) {
            ledgerService.transfer(TransferRequest.credit(userId, total, TransferKind.AWARD, challenge,
                    "award:participant:" + participantId,
                    Map.of("participant_id", participantId, "prize", challenge.getPrizeAmount(),
                            "bonus", challenge.getBonusAmount())));
            participantRepo.recordPrize(participantId, total, ParticipantStatus.COMPLETED);
        }

        eventPublisher.publishEvent(new ChallengeCompleted(participantId, userId, challenge.getId(), total));
        log.info("[挑戰結算] 參加者 {} 完成挑戰 {}「{}」，發放 {} 點",
                participantId, challenge.getId(), challenge.getTitle(), total);
        return SettlementOutcome.settled(participantId, total);
    }

    /**
     * 寫入最新的驗證進度（不論是否完成都會寫入）。
     */
    @Transactional(timeout = 10)
    public void recordProgress(Long participantId, ChallengeProgress progress, Instant now) {
        participantRepo.updateProgress(participantId, codec.writeProgress(progress),
                progress.progressPercentage(), now);
    }

    /**
     * 啟用挑戰：檢查設定 → DRAFT → ACTIVE → 從建立者預留 獎金 × 人數上限。
     *
     * @throws com.aiinpocket.rewards.exception.ChallengeConfigException 設定不合法
     * @throws com.aiinpocket.rewards.exception.InsufficientBalanceException 建立者餘額不足，整個啟用回滾
     * @throws InvalidStateTransitionException 挑戰不是 DRAFT
     */
    @Transactional
    public Challenge activate(Long challengeId) {
        Challenge challenge = challengeRepo.findById(challengeId)
                .orElseThrow(() -> new IllegalArgumentException("挑戰不存在: " + challengeId));
        codec.readValidConfig(challenge.getType(), challenge.getConfigJson());

        Instant now = Instant.now();
        if (!challenge.getEndDate().isAfter(now)) {
            throw new InvalidStateTransitionException("挑戰 " + challengeId + " 的結束時間已過，無法啟用");
        }
        ChallengeStatus from = challenge.getStatus();
        int claimed = challengeRepo.transition(challengeId, List.of(ChallengeStatus.DRAFT), ChallengeStatus.ACTIVE, now);
        if (claimed == 0) {
            throw new InvalidStateTransitionException("Challenge", challengeId, from, ChallengeStatus.ACTIVE);
        }

        challenge = challengeRepo.findById(challengeId).orElseThrow();
        int participants = challenge.getMaxParticipants() != null
                ? challenge.getMaxParticipants()
                : properties.settlement().defaultReserveParticipants();
        long reserve = challenge.getPrizeAmount() * participants;
        if (reserve > 0) {
            ledgerService.transfer(TransferRequest.debit(challenge.getCreator().getId(), reserve,
                    TransferKind.RESERVE, challenge, "reserve:challenge:" + challengeId,
                    Map.of("participants", participants, "prize", challenge.getPrizeAmount())));
        }
        challenge.setReservedAmount(reserve);
        if (challenge.getStartDate() == null) {
            challenge.setStartDate(now);
        }
        challengeRepo.save(challenge);

        log.info("[挑戰結算] 挑戰 {}「{}」已啟用，預留 {} 點", challengeId, challenge.getTitle(), reserve);
        return challenge;
    }

    /**
     * 取消挑戰（DRAFT / ACTIVE / PAUSED → CANCELLED），ACTIVE 的參加者標記為 FAILED，退還剩餘預留。
     * 尚未接受的邀請保持 INVITED，挑戰結束後已無法接受。
     *
     * @return 退還的點數
     */
    @Transactional
    public long cancel(Long challengeId, String reason) {
        long refunded = close(challengeId, ChallengeStatus.CANCELLED,
                List.of(ChallengeStatus.DRAFT, ChallengeStatus.ACTIVE, ChallengeStatus.PAUSED), reason);
        if (refunded < 0) {
            Challenge challenge = challengeRepo.findById(challengeId).orElseThrow();
            throw new InvalidStateTransitionException("Challenge", challengeId, challenge.getStatus(),
                    ChallengeStatus.CANCELLED);
        }
        return refunded;
    }

    /**
     * 到期結束挑戰（ACTIVE / PAUSED → COMPLETED）。已被其他程序結束時回傳 0。
     *
     * @return 退還的點數
     */
    @Transactional
    public long expire(Long challengeId) {
        long refunded = close(challengeId, ChallengeStatus.COMPLETED,
                List.of(ChallengeStatus.ACTIVE, ChallengeStatus.PAUSED), "expired");
        return Math.max(refunded, 0);
    }

    /**
     * @return 退還金額；未取得轉換權時回傳 -1
     */
    private long close(Long challengeId, ChallengeStatus target, List<ChallengeStatus> from, String reason) {
        Instant now = Instant.now();
        int claimed = challengeRepo.transition(challengeId, from, target, now);
        if (claimed == 0) {
            log.debug("[挑戰結算] 挑戰 {} 無法轉為 {}，略過", challengeId, target);
            return -1;
        }

        int failed = participantRepo.transitionRemaining(challengeId, List.of(ParticipantStatus.ACTIVE),
                ParticipantStatus.FAILED, now);
        Challenge challenge = challengeRepo.findById(challengeId)
                .orElseThrow(() -> new IllegalArgumentException("挑戰不存在: " + challengeId));
        long awarded = transferRepo.sumByChallengeAndKind(challengeId, TransferKind.AWARD, TransferStatus.COMPLETED);
        long refund = Math.max(0, challenge.getReservedAmount() - awarded);
        if (refund > 0) {
            ledgerService.transfer(TransferRequest.credit(challenge.getCreator().getId(), refund,
                    TransferKind.REFUND, challenge, "refund:challenge:" + challengeId,
                    Map.of("reason", reason != null ? reason : "", "reserved", challenge.getReservedAmount(),
                            "awarded", awarded)));
        }

        log.info("[挑戰結算] 挑戰 {} → {}（原因: {}），{} 位參加者未完成，退還 {} 點",
                challengeId, target, reason, failed, refund);
        return refund;
    }
}

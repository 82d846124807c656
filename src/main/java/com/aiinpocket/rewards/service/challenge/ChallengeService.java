package com.aiinpocket.rewards.service.challenge;

import com.aiinpocket.rewards.config.RewardEngineProperties;
import com.aiinpocket.rewards.exception.InsufficientBalanceException;
import com.aiinpocket.rewards.exception.InvalidStateTransitionException;
import com.aiinpocket.rewards.model.config.ChallengeConfig;
import com.aiinpocket.rewards.model.dto.ChallengeDraft;
import com.aiinpocket.rewards.model.entity.AppUser;
import com.aiinpocket.rewards.model.entity.Challenge;
import com.aiinpocket.rewards.model.entity.ChallengeParticipant;
import com.aiinpocket.rewards.model.enums.ChallengeStatus;
import com.aiinpocket.rewards.model.enums.ParticipantStatus;
import com.aiinpocket.rewards.repository.AppUserRepository;
import com.aiinpocket.rewards.repository.ChallengeParticipantRepository;
import com.aiinpocket.rewards.repository.ChallengeRepository;
import com.aiinpocket.rewards.service.settlement.SettlementService;
import com.aiinpocket.rewards.service.validation.ChallengeJsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * 挑戰生命週期：建立草稿、加入 / 接受邀請 / 放棄、暫停 / 恢復，
 * 啟用與取消交給 {@link SettlementService}（涉及預留與退款）。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChallengeService {

    private static final List<ParticipantStatus> OCCUPYING =
            List.of(ParticipantStatus.ACTIVE, ParticipantStatus.COMPLETED);

    private final ChallengeRepository challengeRepo;
    private final ChallengeParticipantRepository participantRepo;
    private final AppUserRepository userRepo;
    private final SettlementService settlementService;
    private final ChallengeJsonCodec codec;
    private final RewardEngineProperties properties;

    /**
     * 建立挑戰草稿。設定在啟用時才做完整檢查，但建立者餘額必須足以支付預估的預留金。
     */
    @Transactional
    public Challenge createDraft(ChallengeDraft draft) {
        if (draft.config() == null) {
            throw new IllegalArgumentException("挑戰設定為必填");
        }
        if (draft.prizeAmount() < 0 || draft.bonusAmount() < 0) {
            throw new IllegalArgumentException("獎金不可為負數");
        }
        if (draft.maxParticipants() != null && draft.maxParticipants() < 1) {
            throw new IllegalArgumentException("人數上限必須至少為 1");
        }
        if (draft.endDate() == null || (draft.startDate() != null && !draft.endDate().isAfter(draft.startDate()))) {
            throw new IllegalArgumentException("結束時間必須晚於開始時間");
        }
        AppUser creator = userRepo.findById(draft.creatorId())
                .orElseThrow(() -> new IllegalArgumentException("使用者不存在: " + draft.creatorId()));

        long estimatedReserve = draft.prizeAmount() * (draft.maxParticipants() != null
                ? draft.maxParticipants()
                : properties.settlement().defaultReserveParticipants());
        if (creator.getBalance() < estimatedReserve) {
            throw new InsufficientBalanceException(creator.getId(), creator.getBalance(), estimatedReserve);
        }

        Challenge challenge = challengeRepo.save(Challenge.builder()
                .creator(creator)
                .title(draft.title())
                .type(draft.config().type())
                .configJson(codec.writeConfig(draft.config()))
                .prizeAmount(draft.prizeAmount())
                .bonusAmount(draft.bonusAmount())
                .maxParticipants(draft.maxParticipants())
                .autoAccept(draft.autoAccept())
                .startDate(draft.startDate())
                .endDate(draft.endDate())
                .status(ChallengeStatus.DRAFT)
                .build());
        log.info("[挑戰] 使用者 {} 建立 {} 挑戰草稿 {}「{}」", creator.getId(), challenge.getType(),
                challenge.getId(), challenge.getTitle());
        return challenge;
    }

    /** 修改草稿設定（啟用後不可修改） */
    @Transactional
    public Challenge updateDraftConfig(Long challengeId, ChallengeConfig config) {
        Challenge challenge = challengeRepo.findByIdForUpdate(challengeId)
                .orElseThrow(() -> new IllegalArgumentException("挑戰不存在: " + challengeId));
        if (challenge.getStatus() != ChallengeStatus.DRAFT) {
            throw new InvalidStateTransitionException("挑戰 " + challengeId + " 已離開草稿狀態，設定不可修改");
        }
        if (config.type() != challenge.getType()) {
            throw new IllegalArgumentException("設定類型 " + config.type() + " 與挑戰類型 " + challenge.getType() + " 不符");
        }
        challenge.setConfigJson(codec.writeConfig(config));
        return challengeRepo.save(challenge);
    }

    public Challenge activate(Long challengeId) {
        return settlementService.activate(challengeId);
    }

    public long cancel(Long challengeId, String reason) {
        return settlementService.cancel(challengeId, reason);
    }

    /**
     * 加入挑戰。鎖定挑戰列後檢查人數上限（ACTIVE + COMPLETED），
     * autoAccept 的挑戰直接成為 ACTIVE，否則為 INVITED 等待接受。
     */
    @Transactional
    public ChallengeParticipant join(Long challengeId, Long userId) {
        Instant now = Instant.now();
        Challenge challenge = challengeRepo.findByIdForUpdate(challengeId)
                .orElseThrow(() -> new IllegalArgumentException("挑戰不存在: " + challengeId));
        if (challenge.getStatus() != ChallengeStatus.ACTIVE || !challenge.getEndDate().isAfter(now)) {
            throw new InvalidStateTransitionException("挑戰 " + challengeId + " 目前無法加入");
        }
        if (participantRepo.existsByChallengeIdAndUserId(challengeId, userId)) {
            throw new IllegalArgumentException("使用者 " + userId + " 已參加挑戰 " + challengeId);
        }
        if (challenge.getMaxParticipants() != null
                && participantRepo.countByChallengeIdAndStatusIn(challengeId, OCCUPYING) >= challenge.getMaxParticipants()) {
            throw new InvalidStateTransitionException("挑戰 " + challengeId + " 已額滿");
        }
        AppUser user = userRepo.findById(userId)
                .orElseThrow(() -> new IllegalArgumentException("使用者不存在: " + userId));

        boolean autoAccept = challenge.isAutoAccept();
        ChallengeParticipant participant = participantRepo.save(ChallengeParticipant.builder()
                .challenge(challenge)
                .user(user)
                .status(autoAccept ? ParticipantStatus.ACTIVE : ParticipantStatus.INVITED)
                .joinedAt(now)
                .startedAt(autoAccept ? now : null)
                .build());
        log.info("[挑戰] 使用者 {} 加入挑戰 {}（{}）", userId, challengeId, participant.getStatus());
        return participant;
    }

    /** 接受邀請：INVITED → ACTIVE，進度從接受的時間開始計算 */
    @Transactional
    public void acceptInvitation(Long participantId) {
        ChallengeParticipant participant = participantRepo.findWithChallengeById(participantId)
                .orElseThrow(() -> new IllegalArgumentException("參加者不存在: " + participantId));
        if (!participant.getStatus().canTransitionTo(ParticipantStatus.ACTIVE)) {
            throw new InvalidStateTransitionException("ChallengeParticipant", participantId,
                    participant.getStatus(), ParticipantStatus.ACTIVE);
        }
        Challenge challenge = participant.getChallenge();
        if (challenge.getStatus() != ChallengeStatus.ACTIVE || !challenge.getEndDate().isAfter(Instant.now())) {
            throw new InvalidStateTransitionException("挑戰 " + challenge.getId() + " 已不在進行中，無法接受邀請");
        }
        if (challenge.getMaxParticipants() != null) {
            challengeRepo.findByIdForUpdate(challenge.getId());
            if (participantRepo.countByChallengeIdAndStatusIn(challenge.getId(), OCCUPYING) >= challenge.getMaxParticipants()) {
                throw new InvalidStateTransitionException("挑戰 " + challenge.getId() + " 已額滿");
            }
        }
        int updated = participantRepo.start(participantId, ParticipantStatus.INVITED, ParticipantStatus.ACTIVE,
                Instant.now());
        if (updated == 0) {
            throw new InvalidStateTransitionException("ChallengeParticipant", participantId,
                    participant.getStatus(), ParticipantStatus.ACTIVE);
        }
        log.info("[挑戰] 參加者 {} 接受挑戰 {} 的邀請", participantId, challenge.getId());
    }

    /** 放棄挑戰：ACTIVE → ABANDONED */
    @Transactional
    public void abandon(Long participantId) {
        ChallengeParticipant participant = participantRepo.findById(participantId)
                .orElseThrow(() -> new IllegalArgumentException("參加者不存在: " + participantId));
        if (!participant.getStatus().canTransitionTo(ParticipantStatus.ABANDONED)) {
            throw new InvalidStateTransitionException("ChallengeParticipant", participantId,
                    participant.getStatus(), ParticipantStatus.ABANDONED);
        }
        int updated = participantRepo.transition(participantId, ParticipantStatus.ACTIVE,
                ParticipantStatus.ABANDONED, Instant.now());
        if (updated == 0) {
            throw new InvalidStateTransitionException("ChallengeParticipant", participantId,
                    participant.getStatus(), ParticipantStatus.ABANDONED);
        }
        log.info("[挑戰] 參加者 {} 放棄挑戰", participantId);
    }

    /** 暫停：ACTIVE → PAUSED，暫停期間不驗證也不能加入，預留金保持不變 */
    @Transactional
    public void pause(Long challengeId) {
        changeStatus(challengeId, ChallengeStatus.ACTIVE, ChallengeStatus.PAUSED);
    }

    /** 恢復：PAUSED → ACTIVE，不會重新預留 */
    @Transactional
    public void resume(Long challengeId) {
        changeStatus(challengeId, ChallengeStatus.PAUSED, ChallengeStatus.ACTIVE);
    }

    private void changeStatus(Long challengeId, ChallengeStatus from, ChallengeStatus to) {
        Challenge challenge = challengeRepo.findById(challengeId)
                .orElseThrow(() -> new IllegalArgumentException("挑戰不存在: " + challengeId));
        int updated = challengeRepo.transition(challengeId, List.of(from), to, Instant.now());
        if (updated == 0) {
            throw new InvalidStateTransitionException("Challenge", challengeId, challenge.getStatus(), to);
        }
        log.info("[挑戰] 挑戰 {} {} → {}", challengeId, from, to);
    }
}

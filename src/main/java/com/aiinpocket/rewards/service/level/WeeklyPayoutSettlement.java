package com.aiinpocket.rewards.service.level;

import com.aiinpocket.rewards.config.RewardEngineProperties;
import com.aiinpocket.rewards.model.dto.TransferRequest;
import com.aiinpocket.rewards.model.entity.TierDefinition;
import com.aiinpocket.rewards.model.entity.TierRecord;
import com.aiinpocket.rewards.model.entity.WeeklyPayout;
import com.aiinpocket.rewards.model.enums.PayoutStatus;
import com.aiinpocket.rewards.model.enums.TierKind;
import com.aiinpocket.rewards.model.enums.TransferKind;
import com.aiinpocket.rewards.model.event.LevelPayoutPaid;
import com.aiinpocket.rewards.repository.TierRecordRepository;
import com.aiinpocket.rewards.repository.WeeklyPayoutRepository;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import com.aiinpocket.rewards.service.settlement.LedgerService;
import com.aiinpocket.rewards.service.validation.ChallengeJsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 單筆每週發放的交易單位：建立發放紀錄、入帳、標記失敗。每個方法各自一個交易。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WeeklyPayoutSettlement {

    private final WeeklyPayoutRepository payoutRepo;
    private final TierRecordRepository recordRepo;
    private final ActivityReadModel readModel;
    private final PayoutBonusCalculator bonusCalculator;
    private final LedgerService ledgerService;
    private final ChallengeJsonCodec codec;
    private final ApplicationEventPublisher eventPublisher;
    private final RewardEngineProperties properties;

    /**
     * 建立 PENDING 發放紀錄。同一週已有紀錄，或目前活躍人數未達等級下限
     * （等級查找退回最低級的情況）時回傳 empty。
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<WeeklyPayout> createPayout(Long tierRecordId, LocalDate weekStart, Instant now) {
        TierRecord record = recordRepo.findById(tierRecordId)
                .orElseThrow(() -> new IllegalArgumentException("等級紀錄不存在: " + tierRecordId));
        Long userId = record.getUser().getId();
        TierKind kind = record.getKind();
        if (payoutRepo.existsByUserIdAndKindAndWeekStart(userId, kind, weekStart)) {
            log.debug("[每週發放] 使用者 {} 的 {} 發放已存在 (週 {})", userId, kind, weekStart);
            return Optional.empty();
        }

        TierDefinition tier = record.getCurrentTier();
        Instant since = now.minus(Duration.ofDays(properties.levels().activeWindowDays()));
        long active = kind == TierKind.CREATOR
                ? readModel.activePlayers(userId, since)
                : readModel.activeStudents(userId, since);
        if (active < tier.getMinThreshold()) {
            log.info("[每週發放] 使用者 {} 的 {} 活躍人數 {} 未達 {} 門檻 {}，本週不發放",
                    userId, kind, active, tier.getName(), tier.getMinThreshold());
            return Optional.empty();
        }

        long base = tier.getWeeklyPayout();
        long previous = previousActiveCount(userId, kind, weekStart.minusWeeks(1));
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("active_users", active);
        long bonus;
        if (kind == TierKind.CREATOR) {
            bonus = bonusCalculator.creatorBonus(base, active, previous);
        } else {
            double consolidation = readModel.studentAverageConsolidation(userId,
                    now.minus(Duration.ofDays(properties.levels().studentConsolidationDays())));
            bonus = bonusCalculator.teacherBonus(base, active, previous, consolidation);
            metrics.put("student_average_consolidation", consolidation);
        }
        metrics.put("previous_active_users", previous);
        metrics.put("tier", tier.getName());
        metrics.put("level_achieved_at", record.getAchievedAt().toString());

        WeeklyPayout payout = payoutRepo.save(WeeklyPayout.builder()
                .user(record.getUser())
                .kind(kind)
                .tier(tier)
                .weekStart(weekStart)
                .weekEnd(weekStart.plusDays(6))
                .baseAmount(base)
                .bonusAmount(bonus)
                .totalAmount(base + bonus)
                .metricsJson(codec.writeMap(metrics))
                .status(PayoutStatus.PENDING)
                .build());
        log.info("[每週發放] 建立使用者 {} 的 {} 發放: 基本 {} + 加成 {} (週 {})",
                userId, kind, base, bonus, weekStart);
        return Optional.of(payout);
    }

    /**
     * 入帳：PENDING → PAID，基本發放記為 LEVEL_PAYOUT，加成記為 BONUS。
     *
     * @return 是否由本次呼叫入帳（已被其他程序處理時為 false）
     */
    @Transactional(timeout = 10)
    public boolean pay(Long payoutId) {
        int claimed = payoutRepo.transition(payoutId, PayoutStatus.PENDING, PayoutStatus.PAID, Instant.now());
        if (claimed == 0) {
            log.debug("[每週發放] 發放 {} 已被處理，略過", payoutId);
            return false;
        }
        WeeklyPayout payout = payoutRepo.findById(payoutId)
                .orElseThrow(() -> new IllegalArgumentException("發放紀錄不存在: " + payoutId));
        Long userId = payout.getUser().getId();
        Map<String, Object> reference = Map.of("payout_id", payoutId, "week_start", payout.getWeekStart().toString());

        ledgerService.transfer(TransferRequest.credit(userId, payout.getBaseAmount(), TransferKind.LEVEL_PAYOUT,
                null, "payout:" + payoutId + ":base", reference));
        if (payout.getBonusAmount() > 0) {
            ledgerService.transfer(TransferRequest.credit(userId, payout.getBonusAmount(), TransferKind.BONUS,
                    null, "payout:" + payoutId + ":bonus", reference));
        }

        eventPublisher.publishEvent(new LevelPayoutPaid(payoutId, userId, payout.getKind(), payout.getWeekStart(),
                payout.getBaseAmount(), payout.getBonusAmount()));
        log.info("[每週發放] 使用者 {} 收到 {} 點 ({} 週 {})", userId, payout.getTotalAmount(),
                payout.getKind(), payout.getWeekStart());
        return true;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(Long payoutId) {
        payoutRepo.transition(payoutId, PayoutStatus.PENDING, PayoutStatus.FAILED, Instant.now());
    }

    /** 失敗的發放重新排入：FAILED → PENDING */
    @Transactional
    public boolean requeue(Long payoutId) {
        return payoutRepo.transition(payoutId, PayoutStatus.FAILED, PayoutStatus.PENDING, Instant.now()) == 1;
    }

    private long previousActiveCount(Long userId, TierKind kind, LocalDate previousWeekStart) {
        return payoutRepo.findByUserIdAndKindAndWeekStart(userId, kind, previousWeekStart)
                .map(p -> codec.readMap(p.getMetricsJson()).get("active_users"))
                .filter(Number.class::isInstance)
                .map(v -> ((Number) v).longValue())
                .orElse(0L);
    }
}

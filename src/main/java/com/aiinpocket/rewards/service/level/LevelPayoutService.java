package com.aiinpocket.rewards.service.level;

import com.aiinpocket.rewards.config.RewardEngineProperties;
import com.aiinpocket.rewards.model.dto.PayoutRunSummary;
import com.aiinpocket.rewards.model.entity.TierRecord;
import com.aiinpocket.rewards.model.entity.WeeklyPayout;
import com.aiinpocket.rewards.model.enums.PayoutStatus;
import com.aiinpocket.rewards.model.enums.TierKind;
import com.aiinpocket.rewards.repository.TierRecordRepository;
import com.aiinpocket.rewards.repository.WeeklyPayoutRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Optional;

/**
 * 創作者 / 教師等級的每週發放。
 * 週從星期一開始；每位使用者每種等級每週只會有一筆發放紀錄，
 * 每筆發放各自一個交易，單筆失敗標記為 FAILED，不影響其他人。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LevelPayoutService {

    private static final List<TierKind> PAYABLE_KINDS = List.of(TierKind.CREATOR, TierKind.TEACHER);

    private final TierRecordRepository recordRepo;
    private final WeeklyPayoutRepository payoutRepo;
    private final WeeklyPayoutSettlement payoutSettlement;
    private final RewardEngineProperties properties;

    /** 本週（依設定時區）的發放 */
    public PayoutRunSummary runWeeklyPayouts() {
        return processWeeklyPayouts(LocalDate.now(properties.zone()));
    }

    /**
     * 處理指定日期所在週的發放：為符合資格的等級紀錄建立發放，再逐筆入帳。
     */
    public PayoutRunSummary processWeeklyPayouts(LocalDate anyDayOfWeek) {
        LocalDate weekStart = weekStartOf(anyDayOfWeek);
        Instant now = Instant.now();
        Instant cutoff = weekStart.plusWeeks(1).atStartOfDay(properties.zone()).toInstant();
        log.info("[每週發放] 開始處理 {} 當週的發放", weekStart);

        int created = 0;
        int failed = 0;
        for (TierRecord record : recordRepo.findPayable(PAYABLE_KINDS, cutoff)) {
            try {
                Optional<WeeklyPayout> payout = payoutSettlement.createPayout(record.getId(), weekStart, now);
                if (payout.isPresent()) {
                    created++;
                }
            } catch (DataIntegrityViolationException e) {
                log.debug("[每週發放] 使用者 {} 的 {} 發放已由其他程序建立", record.getUser().getId(), record.getKind());
            } catch (Exception e) {
                failed++;
                log.error("[每週發放] 建立使用者 {} 的 {} 發放失敗: {}",
                        record.getUser().getId(), record.getKind(), e.getMessage(), e);
            }
        }

        PayoutRunSummary paidSummary = payPending(weekStart);
        PayoutRunSummary summary = new PayoutRunSummary(weekStart, created, paidSummary.paid(),
                failed + paidSummary.failed(), paidSummary.totalAmount());
        log.info("[每週發放] 週 {} 完成: 建立 {} 筆，入帳 {} 筆，失敗 {} 筆，共 {} 點",
                weekStart, summary.created(), summary.paid(), summary.failed(), summary.totalAmount());
        return summary;
    }

    /**
     * 將指定週失敗的發放重新入帳。
     */
    public PayoutRunSummary retryFailedPayouts(LocalDate anyDayOfWeek) {
        LocalDate weekStart = weekStartOf(anyDayOfWeek);
        List<Long> failedIds = payoutRepo.findIdsByWeekStartAndStatus(weekStart, PayoutStatus.FAILED);
        int requeued = 0;
        for (Long id : failedIds) {
            if (payoutSettlement.requeue(id)) {
                requeued++;
            }
        }
        log.info("[每週發放] 週 {} 重新排入 {} 筆失敗的發放", weekStart, requeued);
        return payPending(weekStart);
    }

    public static LocalDate weekStartOf(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    private PayoutRunSummary payPending(LocalDate weekStart) {
        int paid = 0;
        int failed = 0;
        long total = 0;
        for (Long id : payoutRepo.findIdsByWeekStartAndStatus(weekStart, PayoutStatus.PENDING)) {
            try {
                if (payoutSettlement.pay(id)) {
                    paid++;
                    total += payoutRepo.findById(id).map(WeeklyPayout::getTotalAmount).orElse(0L);
                }
            } catch (Exception e) {
                failed++;
                log.error("[每週發放] 發放 {} 入帳失敗: {}", id, e.getMessage(), e);
                payoutSettlement.markFailed(id);
            }
        }
        return new PayoutRunSummary(weekStart, 0, paid, failed, total);
    }
}

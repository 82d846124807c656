package com.aiinpocket.rewards.service.level;

import com.aiinpocket.rewards.config.RewardEngineProperties;
import com.aiinpocket.rewards.model.dto.TierChangeResult;
import com.aiinpocket.rewards.model.entity.AppUser;
import com.aiinpocket.rewards.model.entity.PromotionHistory;
import com.aiinpocket.rewards.model.entity.TierDefinition;
import com.aiinpocket.rewards.model.entity.TierRecord;
import com.aiinpocket.rewards.model.enums.TierChangeDirection;
import com.aiinpocket.rewards.model.enums.TierKind;
import com.aiinpocket.rewards.model.event.TierChanged;
import com.aiinpocket.rewards.repository.AppUserRepository;
import com.aiinpocket.rewards.repository.PromotionHistoryRepository;
import com.aiinpocket.rewards.repository.TierDefinitionRepository;
import com.aiinpocket.rewards.repository.TierRecordRepository;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import com.aiinpocket.rewards.service.validation.ChallengeJsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 等級計算。
 *
 * <p>USER_TOPIC 以題組鞏固度為指標（每個題組一筆紀錄），CREATOR 以近期在其題組上遊玩的
 * 不重複玩家數為指標，TEACHER 同上但排除教師本人。
 * 新等級與目前等級相同時不做任何事（除非強制重算）；等級改變時更新紀錄、
 * 新增一筆升降級歷史並發布 {@link TierChanged} 事件。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LevelCalculatorService {

    private final TierLadderService ladderService;
    private final TierRecordRepository recordRepo;
    private final TierDefinitionRepository definitionRepo;
    private final PromotionHistoryRepository historyRepo;
    private final AppUserRepository userRepo;
    private final ActivityReadModel readModel;
    private final ChallengeJsonCodec codec;
    private final ApplicationEventPublisher eventPublisher;
    private final RewardEngineProperties properties;

    /** 指標對應的等級（不會回傳 null） */
    public TierDefinition tierFor(TierKind kind, double metric) {
        return ladderService.ladder(kind).tierFor(metric);
    }

    /**
     * 重新計算單一範圍的等級。
     *
     * @param blockId USER_TOPIC 必填，其他種類必須為 null
     * @param force   等級未變時仍更新紀錄的指標快照
     */
    @Transactional
    public TierChangeResult recalculate(Long userId, TierKind kind, Long blockId, boolean force) {
        if (kind.isScoped() != (blockId != null)) {
            throw new IllegalArgumentException(kind + " 等級的範圍設定錯誤: blockId=" + blockId);
        }
        Instant now = Instant.now();
        Map<String, Object> metrics = collectMetrics(userId, kind, blockId, now);
        double metric = ((Number) metrics.get("metric_value")).doubleValue();
        TierDefinition newTier = tierFor(kind, metric);

        Optional<TierRecord> existing = blockId != null
                ? recordRepo.findByUserIdAndKindAndBlockId(userId, kind, blockId)
                : recordRepo.findByUserIdAndKindAndBlockIdIsNull(userId, kind);
        TierDefinition previousTier = existing.map(TierRecord::getCurrentTier).orElse(null);
        boolean changed = previousTier == null || !Objects.equals(previousTier.getId(), newTier.getId());

        if (!changed && !force) {
            log.debug("[等級] 使用者 {} 的 {} 等級維持 {}（指標 {}）", userId, kind, newTier.getName(), metric);
            return TierChangeResult.unchanged(previousTier, metric);
        }

        String metricsJson = codec.writeMap(metrics);
        TierRecord record = existing.orElseGet(() -> TierRecord.builder()
                .user(findUser(userId))
                .kind(kind)
                .blockId(blockId)
                .build());
        record.setMetricValue(metric);
        record.setMetricsJson(metricsJson);
        record.setLastCalculatedAt(now);
        if (changed) {
            record.setCurrentTier(definitionRepo.getReferenceById(newTier.getId()));
            record.setAchievedAt(now);
        }
        recordRepo.save(record);

        if (!changed) {
            log.debug("[等級] 強制重算使用者 {} 的 {} 等級，維持 {}", userId, kind, newTier.getName());
            return TierChangeResult.unchanged(previousTier, metric);
        }

        TierChangeDirection direction = directionOf(previousTier, newTier);
        historyRepo.save(PromotionHistory.builder()
                .user(record.getUser())
                .kind(kind)
                .blockId(blockId)
                .previousTier(previousTier != null ? definitionRepo.getReferenceById(previousTier.getId()) : null)
                .newTier(definitionRepo.getReferenceById(newTier.getId()))
                .direction(direction)
                .metricsJson(metricsJson)
                .promotedAt(now)
                .build());

        eventPublisher.publishEvent(new TierChanged(userId, kind, blockId,
                previousTier != null ? previousTier.getId() : null, newTier.getId(), newTier.getName(),
                direction, metrics));
        log.info("[等級] 使用者 {} 的 {} 等級{}: {} → {}（指標 {}）", userId, kind,
                blockId != null ? "（題組 " + blockId + "）" : "", previousTier != null ? previousTier.getName() : "無",
                newTier.getName(), metric);
        return new TierChangeResult(true, previousTier, newTier, direction, metric);
    }

    /**
     * 重算使用者所有等級：作答過的每個題組，以及創作者 / 教師身分對應的等級。
     *
     * @return 等級有變動的數量
     */
    @Transactional
    public int recalculateAll(Long userId) {
        AppUser user = findUser(userId);
        int changes = 0;
        for (Long blockId : readModel.answeredBlockIds(userId)) {
            if (recalculate(userId, TierKind.USER_TOPIC, blockId, false).changed()) {
                changes++;
            }
        }
        if (user.isContentCreator() && recalculate(userId, TierKind.CREATOR, null, false).changed()) {
            changes++;
        }
        if (user.isTeacher() && recalculate(userId, TierKind.TEACHER, null, false).changed()) {
            changes++;
        }
        return changes;
    }

    private Map<String, Object> collectMetrics(Long userId, TierKind kind, Long blockId, Instant now) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        int windowDays = properties.levels().activeWindowDays();
        Instant since = now.minus(Duration.ofDays(windowDays));
        switch (kind) {
            case USER_TOPIC -> {
                double consolidation = readModel.blockConsolidation(userId, blockId);
                metrics.put("metric_value", consolidation);
                metrics.put("consolidation_percentage", consolidation);
                metrics.put("block_id", blockId);
            }
            case CREATOR -> {
                long activeUsers = readModel.activePlayers(userId, since);
                metrics.put("metric_value", activeUsers);
                metrics.put("active_users", activeUsers);
                metrics.put("window_days", windowDays);
            }
            case TEACHER -> {
                long activeStudents = readModel.activeStudents(userId, since);
                metrics.put("metric_value", activeStudents);
                metrics.put("active_students", activeStudents);
                metrics.put("window_days", windowDays);
            }
        }
        metrics.put("calculated_at", now.toString());
        return metrics;
    }

    private static TierChangeDirection directionOf(TierDefinition previous, TierDefinition current) {
        if (previous == null) {
            return TierChangeDirection.INITIAL;
        }
        return current.getLevelOrder() > previous.getLevelOrder()
                ? TierChangeDirection.PROMOTION
                : TierChangeDirection.DEMOTION;
    }

    private AppUser findUser(Long userId) {
        return userRepo.findById(userId)
                .orElseThrow(() -> new IllegalArgumentException("使用者不存在: " + userId));
    }
}

package com.aiinpocket.rewards.service.orchestration;

import com.aiinpocket.rewards.config.RewardEngineProperties;
import com.aiinpocket.rewards.model.dto.LevelRunSummary;
import com.aiinpocket.rewards.repository.AppUserRepository;
import com.aiinpocket.rewards.service.level.LevelCalculatorService;
import com.aiinpocket.rewards.service.metrics.ActivityReadModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.TreeSet;

/**
 * 每日等級重算：近期有活動的使用者（含有人遊玩其題組的創作者），
 * 以及所有創作者與教師（沒有活動時也要重算，才會降級），逐一重算所有等級。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LevelRecalculationOrchestrator {

    private final ActivityReadModel readModel;
    private final AppUserRepository userRepo;
    private final LevelCalculatorService levelCalculator;
    private final RewardEngineProperties properties;

    public LevelRunSummary runLevelRecalculation() {
        Instant since = Instant.now().minus(Duration.ofHours(properties.levels().recentActivityHours()));
        Set<Long> userIds = new TreeSet<>(readModel.recentlyActiveUserIds(since));
        userIds.addAll(userRepo.findCreatorAndTeacherIds());
        log.info("[等級重算] 開始重算 {} 位使用者", userIds.size());

        int changes = 0;
        int errors = 0;
        for (Long userId : userIds) {
            try {
                changes += levelCalculator.recalculateAll(userId);
            } catch (Exception e) {
                errors++;
                log.error("[等級重算] 使用者 {} 重算失敗: {}", userId, e.getMessage(), e);
            }
        }

        LevelRunSummary summary = new LevelRunSummary(userIds.size(), changes, errors);
        log.info("[等級重算] 完成: 使用者 {} 位，等級變動 {} 筆，錯誤 {} 位",
                summary.usersProcessed(), summary.tierChanges(), summary.errors());
        return summary;
    }
}

package com.aiinpocket.rewards.service.level;

import com.aiinpocket.rewards.config.CacheConfig;
import com.aiinpocket.rewards.model.enums.TierKind;
import com.aiinpocket.rewards.repository.TierDefinitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 等級階梯讀取（Caffeine 快取）。載入時檢查階梯是否連續，有問題只記錄警告。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TierLadderService {

    private final TierDefinitionRepository definitionRepo;

    @Cacheable(cacheNames = CacheConfig.TIER_LADDERS, key = "#kind")
    @Transactional(readOnly = true)
    public TierLadder ladder(TierKind kind) {
        TierLadder ladder = TierLadder.of(kind, definitionRepo.findByKindOrderByLevelOrderAsc(kind));
        List<String> problems = ladder.findProblems();
        if (!problems.isEmpty()) {
            log.warn("[等級階梯] {} 階梯設定有問題: {}", kind, problems);
        }
        log.debug("[等級階梯] 載入 {} 階梯，共 {} 級", kind, ladder.tiers().size());
        return ladder;
    }

    @CacheEvict(cacheNames = CacheConfig.TIER_LADDERS, allEntries = true)
    public void evictAll() {
        log.info("[等級階梯] 清除階梯快取");
    }
}

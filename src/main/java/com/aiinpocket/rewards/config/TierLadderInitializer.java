package com.aiinpocket.rewards.config;

import com.aiinpocket.rewards.model.entity.TierDefinition;
import com.aiinpocket.rewards.model.enums.TierKind;
import com.aiinpocket.rewards.repository.TierDefinitionRepository;
import com.aiinpocket.rewards.service.level.TierLadderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * 等級階梯初始化器。
 * 應用啟動時，若某一種類還沒有任何等級定義，寫入預設階梯。已有定義的種類不會被覆寫。
 *
 * <ul>
 *   <li>使用者（題組鞏固度 %）：Aprendiz → Gran Maestro，不發放點數</li>
 *   <li>創作者（活躍玩家數）：Semilla → Visionario</li>
 *   <li>教師（活躍學生數）：Guía → Maestro Jedi</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TierLadderInitializer {

    private final TierDefinitionRepository definitionRepo;
    private final TierLadderService ladderService;

    private record TierSpec(String name, int min, Integer max, long weeklyPayout, String description) {}

    private static final Map<TierKind, List<TierSpec>> DEFAULT_LADDERS = Map.of(
            TierKind.USER_TOPIC, List.of(
                    new TierSpec("Aprendiz", 0, 25, 0, "剛開始接觸這個題組"),
                    new TierSpec("Explorador", 26, 50, 0, "已掌握部分內容"),
                    new TierSpec("Estratega", 51, 80, 0, "掌握大部分內容"),
                    new TierSpec("Sabio", 81, 95, 0, "幾乎完全掌握"),
                    new TierSpec("Gran Maestro", 96, 100, 0, "完全掌握題組")),
            TierKind.CREATOR, List.of(
                    new TierSpec("Semilla", 1, 49, 40, "第一批玩家"),
                    new TierSpec("Chispa", 50, 149, 60, "題組開始受到關注"),
                    new TierSpec("Constructor", 150, 499, 90, "穩定的玩家社群"),
                    new TierSpec("Orador", 500, 999, 130, "熱門創作者"),
                    new TierSpec("Visionario", 1000, null, 180, "頂尖創作者")),
            TierKind.TEACHER, List.of(
                    new TierSpec("Guía", 1, 15, 50, "小班教學"),
                    new TierSpec("Instructor", 16, 35, 75, "一個班級"),
                    new TierSpec("Consejero", 36, 60, 110, "多個班級"),
                    new TierSpec("Erudito", 61, 100, 150, "整個年級"),
                    new TierSpec("Maestro Jedi", 101, null, 200, "整個學校"))
    );

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    @Order(1)
    public void ensureDefaultLadders() {
        int created = 0;
        for (TierKind kind : TierKind.values()) {
            List<TierSpec> specs = DEFAULT_LADDERS.get(kind);
            if (specs == null || definitionRepo.countByKind(kind) > 0) {
                continue;
            }
            int order = 1;
            for (TierSpec spec : specs) {
                definitionRepo.save(TierDefinition.builder()
                        .kind(kind)
                        .name(spec.name())
                        .levelOrder(order++)
                        .minThreshold(spec.min())
                        .maxThreshold(spec.max())
                        .weeklyPayout(spec.weeklyPayout())
                        .description(spec.description())
                        .build());
            }
            created += specs.size();
            log.info("[等級初始化] 建立 {} 階梯，共 {} 個等級", kind, specs.size());
        }

        if (created > 0) {
            ladderService.evictAll();
        } else {
            log.debug("[等級初始化] 所有等級階梯已存在，跳過初始化");
        }
    }
}

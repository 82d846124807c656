package com.aiinpocket.rewards.service.level;

import com.aiinpocket.rewards.model.entity.TierDefinition;
import com.aiinpocket.rewards.model.enums.TierKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TierLadderTest {

    static TierDefinition tier(long id, TierKind kind, String name, int order, int min, Integer max, long payout) {
        return TierDefinition.builder()
                .id(id).kind(kind).name(name).levelOrder(order)
                .minThreshold(min).maxThreshold(max).weeklyPayout(payout)
                .build();
    }

    static TierLadder userLadder() {
        // 故意打亂順序，階梯會依 levelOrder 排序
        return TierLadder.of(TierKind.USER_TOPIC, List.of(
                tier(3, TierKind.USER_TOPIC, "Estratega", 3, 51, 80, 0),
                tier(1, TierKind.USER_TOPIC, "Aprendiz", 1, 0, 25, 0),
                tier(5, TierKind.USER_TOPIC, "Gran Maestro", 5, 96, 100, 0),
                tier(2, TierKind.USER_TOPIC, "Explorador", 2, 26, 50, 0),
                tier(4, TierKind.USER_TOPIC, "Sabio", 4, 81, 95, 0)));
    }

    static TierLadder creatorLadder() {
        return TierLadder.of(TierKind.CREATOR, List.of(
                tier(11, TierKind.CREATOR, "Semilla", 1, 1, 49, 40),
                tier(12, TierKind.CREATOR, "Chispa", 2, 50, 149, 60),
                tier(13, TierKind.CREATOR, "Constructor", 3, 150, 499, 90),
                tier(14, TierKind.CREATOR, "Orador", 4, 500, 999, 130),
                tier(15, TierKind.CREATOR, "Visionario", 5, 1000, null, 180)));
    }

    @Test
    void everyPercentageMapsToATierInMonotonicOrder() {
        TierLadder ladder = userLadder();
        int previousOrder = 0;
        for (int pct = 0; pct <= 100; pct++) {
            TierDefinition tier = ladder.tierFor(pct);
            assertThat(tier).as("tier for %d%%", pct).isNotNull();
            assertThat(tier.getLevelOrder()).isGreaterThanOrEqualTo(previousOrder);
            previousOrder = tier.getLevelOrder();
        }
        assertThat(previousOrder).isEqualTo(5);
    }

    @Test
    void fractionalMetricIsFlooredBeforeLookup() {
        TierLadder ladder = userLadder();

        assertThat(ladder.tierFor(50.7).getName()).isEqualTo("Explorador");
        assertThat(ladder.tierFor(80.99).getName()).isEqualTo("Estratega");
        assertThat(ladder.tierFor(81.0).getName()).isEqualTo("Sabio");
    }

    @Test
    void openEndedTopTierAndFallbackToLowest() {
        TierLadder ladder = creatorLadder();

        assertThat(ladder.tierFor(1_000_000).getName()).isEqualTo("Visionario");
        assertThat(ladder.tierFor(0).getName()).isEqualTo("Semilla");
        assertThat(ladder.byOrder(3).getName()).isEqualTo("Constructor");
        assertThat(ladder.byOrder(9)).isNull();
    }

    @Test
    void seededLaddersAreContiguous() {
        assertThat(userLadder().findProblems()).isEmpty();
        assertThat(creatorLadder().findProblems()).isEmpty();
    }

    @Test
    void gapsAndOpenMiddleTiersAreReported() {
        TierLadder broken = TierLadder.of(TierKind.TEACHER, List.of(
                tier(1, TierKind.TEACHER, "Guía", 1, 1, 15, 50),
                tier(2, TierKind.TEACHER, "Instructor", 2, 20, null, 75),
                tier(3, TierKind.TEACHER, "Consejero", 3, 36, 60, 110)));

        assertThat(broken.findProblems())
                .anyMatch(p -> p.contains("不連續"))
                .anyMatch(p -> p.contains("沒有上限"));
    }

    @Test
    void emptyLadderIsAConfigurationError() {
        assertThatThrownBy(() -> TierLadder.of(TierKind.TEACHER, List.of()))
                .isInstanceOf(IllegalStateException.class);
    }
}

package com.aiinpocket.rewards.service.level;

import com.aiinpocket.rewards.model.entity.TierDefinition;
import com.aiinpocket.rewards.model.enums.TierKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 單一種類的等級階梯（依 levelOrder 遞增）。
 *
 * <p>門檻為整數，查詢前指標先無條件捨去到整數，
 * 所以 50.7% 落在 [26, 50] 而不是落在 50 與 51 之間的空隙。
 */
public final class TierLadder {

    private final TierKind kind;
    private final List<TierDefinition> tiers;

    private TierLadder(TierKind kind, List<TierDefinition> tiers) {
        this.kind = kind;
        this.tiers = tiers;
    }

    /**
     * @throws IllegalStateException 該種類沒有任何等級定義
     */
    public static TierLadder of(TierKind kind, List<TierDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalStateException("等級階梯未設定: " + kind);
        }
        List<TierDefinition> sorted = new ArrayList<>(definitions);
        sorted.sort(Comparator.comparing(TierDefinition::getLevelOrder));
        return new TierLadder(kind, List.copyOf(sorted));
    }

    public TierKind kind() {
        return kind;
    }

    public List<TierDefinition> tiers() {
        return tiers;
    }

    public TierDefinition lowest() {
        return tiers.get(0);
    }

    /**
     * 取符合指標的最高等級：min ≤ metric 且（沒有上限或 metric ≤ max）。
     * 都不符合時回傳最低等級，不會回傳 null。
     */
    public TierDefinition tierFor(double metric) {
        long floored = (long) Math.floor(metric);
        TierDefinition match = null;
        for (TierDefinition tier : tiers) {
            if (tier.matches(floored)) {
                match = tier;
            }
        }
        return match != null ? match : lowest();
    }

    public TierDefinition byOrder(int levelOrder) {
        return tiers.stream()
                .filter(t -> t.getLevelOrder() == levelOrder)
                .findFirst()
                .orElse(null);
    }

    /**
     * 檢查階梯是否連續：每一級的下限應等於前一級上限 + 1，只有最高級可以沒有上限。
     *
     * @return 發現的問題（空表示沒有問題）
     */
    public List<String> findProblems() {
        List<String> problems = new ArrayList<>();
        for (int i = 0; i < tiers.size(); i++) {
            TierDefinition tier = tiers.get(i);
            if (tier.getMaxThreshold() != null && tier.getMaxThreshold() < tier.getMinThreshold()) {
                problems.add(tier.getName() + " 的上限小於下限");
            }
            if (i == 0) {
                continue;
            }
            TierDefinition previous = tiers.get(i - 1);
            if (previous.getMaxThreshold() == null) {
                problems.add(previous.getName() + " 沒有上限但不是最高等級");
            } else if (tier.getMinThreshold() != previous.getMaxThreshold() + 1) {
                problems.add(previous.getName() + " 與 " + tier.getName() + " 之間的門檻不連續 ("
                        + previous.getMaxThreshold() + " → " + tier.getMinThreshold() + ")");
            }
            if (tier.getMinThreshold() <= previous.getMinThreshold()) {
                problems.add(tier.getName() + " 的下限沒有高於 " + previous.getName());
            }
        }
        return problems;
    }
}

package com.aiinpocket.studyquest.model.dto;

import com.aiinpocket.studyquest.model.enums.Tier;

import java.util.List;

/**
 * 一次段位檢查的結果。晉升為逐階進行，promotedTo 依序列出每一階。
 */
public record RankingOutcome(
        Tier previousTier,
        Tier currentTier,
        List<Tier> promotedTo,
        boolean downgraded
) {
    public static RankingOutcome unchanged(Tier tier) {
        return new RankingOutcome(tier, tier, List.of(), false);
    }

    public boolean promoted() {
        return !promotedTo.isEmpty();
    }

    public boolean changed() {
        return previousTier != currentTier;
    }
}

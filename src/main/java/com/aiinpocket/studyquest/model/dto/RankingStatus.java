package com.aiinpocket.studyquest.model.dto;

import com.aiinpocket.studyquest.model.enums.Tier;

import java.util.List;
import java.util.UUID;

/**
 * 使用者的段位狀態與下一階進度。已在 DIAMOND 時 nextTier 為 null、progressPct 為 100。
 */
public record RankingStatus(
        UUID userId,
        Tier tier,
        String tierName,
        String tierEmoji,
        String tierColor,
        long totalXp,
        int currentStreak,
        Tier nextTier,
        long xpRequired,
        int streakRequired,
        double progressPct,
        double compositeScore,
        List<String> nextMilestones
) {}

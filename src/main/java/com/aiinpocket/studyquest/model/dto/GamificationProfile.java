package com.aiinpocket.studyquest.model.dto;

import com.aiinpocket.studyquest.model.enums.Tier;

import java.util.List;

public record GamificationProfile(
        LevelProgress level,
        int currentStreak,
        int bestStreak,
        double streakMultiplier,
        Tier tier,
        List<UnlockedBadge> badges,
        List<PendingEvent> pendingEvents
) {
    public record UnlockedBadge(
            String key,
            String displayName,
            String description,
            String unlockedAt
    ) {}

    public record PendingEvent(
            Long id,
            String eventType,
            String eventData,
            String createdAt
    ) {}
}

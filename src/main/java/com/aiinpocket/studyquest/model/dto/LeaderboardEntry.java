package com.aiinpocket.studyquest.model.dto;

import com.aiinpocket.studyquest.model.enums.Tier;

import java.util.UUID;

public record LeaderboardEntry(
        int rank,
        UUID userId,
        String displayName,
        Tier tier,
        long totalXp,
        int level,
        int currentStreak,
        double compositeScore
) {}

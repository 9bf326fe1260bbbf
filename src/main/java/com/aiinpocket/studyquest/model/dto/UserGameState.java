package com.aiinpocket.studyquest.model.dto;

import com.aiinpocket.studyquest.model.enums.Tier;

import java.time.Instant;
import java.util.UUID;

/**
 * 計分引擎看到的使用者狀態快照。level 永遠由 totalXp 推導。
 */
public record UserGameState(
        UUID userId,
        String displayName,
        long totalXp,
        int level,
        int currentStreak,
        int bestStreak,
        Tier tier,
        Instant lastActivityAt
) {}

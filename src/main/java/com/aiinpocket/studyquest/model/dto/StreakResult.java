package com.aiinpocket.studyquest.model.dto;

import com.aiinpocket.studyquest.model.enums.StreakMilestone;

/**
 * 連續天數計算結果。milestoneReached 只在這次首次達成時有值。
 */
public record StreakResult(
        int currentStreak,
        int bestStreak,
        double multiplier,
        int bonusXp,
        StreakMilestone milestoneReached
) {
    public static StreakResult none() {
        return new StreakResult(0, 0, 1.0, 0, null);
    }

    public boolean active() {
        return currentStreak > 0;
    }
}

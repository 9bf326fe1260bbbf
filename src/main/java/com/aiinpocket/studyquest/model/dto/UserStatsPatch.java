package com.aiinpocket.studyquest.model.dto;

import java.time.Instant;

/**
 * 使用者統計的部分更新，null 欄位表示不變。
 * totalXp 不在此列：XP 只能透過帳本提交異動。
 */
public record UserStatsPatch(
        Integer currentStreak,
        Integer bestStreak,
        Instant lastActivityAt
) {
    public static UserStatsPatch streak(int current, int best, Instant lastActivityAt) {
        return new UserStatsPatch(current, best, lastActivityAt);
    }
}

package com.aiinpocket.studyquest.model.dto;

/**
 * 單一 session 的 XP 計算明細。
 * base 已套用連續天數倍率；total = base + 兩項獎勵 + 兩項里程碑。
 */
public record XpBreakdown(
        int base,
        int bonusPomodoro,
        int bonusDailyGoal,
        int milestone500,
        int milestone10000,
        int total,
        double multiplier,
        long previousTotal,
        long newTotal,
        int previousLevel,
        int newLevel
) {
    public static XpBreakdown none(long currentTotal, int currentLevel) {
        return new XpBreakdown(0, 0, 0, 0, 0, 0, 1.0, currentTotal, currentTotal, currentLevel, currentLevel);
    }

    public boolean leveledUp() {
        return newLevel > previousLevel;
    }

    public int milestoneTotal() {
        return milestone500 + milestone10000;
    }
}

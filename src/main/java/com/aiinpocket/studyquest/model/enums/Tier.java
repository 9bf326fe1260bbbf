package com.aiinpocket.studyquest.model.enums;

import lombok.Getter;

import java.util.Optional;

/**
 * 段位定義表。
 * 由低到高依序為 BRONZE → SILVER → GOLD → PLATINUM → DIAMOND，晉升只能單向往上一階。
 *
 * <p>每一階有兩組門檻：
 * <ul>
 *   <li>{@code minXp / minStreak}：進入此段位的最低條件（用於純函數判定段位）</li>
 *   <li>{@code promotionXp / promotionStreak}：從此段位晉升到下一階所需條件（XP 與連續天數必須同時滿足）</li>
 * </ul>
 * 另外非 BRONZE 段位有閒置降級天數門檻。
 */
@Getter
public enum Tier {

    BRONZE("Bronze", "🥉", "#CD7F32", 0, 0, 500, 3, 0),
    SILVER("Silver", "🥈", "#C0C0C0", 500, 3, 2000, 7, 14),
    GOLD("Gold", "🥇", "#FFD700", 2000, 7, 5000, 14, 10),
    PLATINUM("Platinum", "💎", "#E5E4E2", 5000, 14, 15000, 30, 7),
    DIAMOND("Diamond", "💎", "#B9F2FF", 15000, 30, 0, 0, 5);

    private final String displayName;
    private final String emoji;
    private final String color;
    private final long minXp;
    private final int minStreak;
    private final long promotionXp;
    private final int promotionStreak;
    /** 閒置超過此天數即重新判定段位（BRONZE 為 0 表示不降級） */
    private final int inactivityDays;

    Tier(String displayName, String emoji, String color, long minXp, int minStreak,
         long promotionXp, int promotionStreak, int inactivityDays) {
        this.displayName = displayName;
        this.emoji = emoji;
        this.color = color;
        this.minXp = minXp;
        this.minStreak = minStreak;
        this.promotionXp = promotionXp;
        this.promotionStreak = promotionStreak;
        this.inactivityDays = inactivityDays;
    }

    /** DIAMOND 為晉升終點 */
    public boolean isTop() {
        return this == DIAMOND;
    }

    public Optional<Tier> next() {
        return isTop() ? Optional.empty() : Optional.of(values()[ordinal() + 1]);
    }

    public boolean isHigherThan(Tier other) {
        return ordinal() > other.ordinal();
    }

    /** 同時滿足 minXp 與 minStreak 才算符合此段位 */
    public boolean admits(long xp, int streak) {
        return xp >= minXp && streak >= minStreak;
    }

    public boolean canDowngrade() {
        return inactivityDays > 0;
    }
}

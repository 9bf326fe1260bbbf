package com.aiinpocket.studyquest.model.enums;

import lombok.Getter;

/**
 * 寬恕係數表（依使用者良好歷史折減懷疑分數）。
 *
 * <ul>
 *   <li>STREAK：每一天連續讀書 0.15，上限 0.25</li>
 *   <li>XP：每 1000 XP 0.08，上限 0.20</li>
 *   <li>CLEAN_HISTORY：近期乾淨 session 比例 × 0.2，上限 0.20</li>
 * </ul>
 * 三項合計再受 {@link #TOTAL_CAP} 限制。
 */
@Getter
public enum ForgivenessFactor {

    STREAK(0.15, 0.25),
    XP(0.08, 0.20),
    CLEAN_HISTORY(0.2, 0.20);

    public static final double TOTAL_CAP = 0.6;

    private final double rate;
    private final double cap;

    ForgivenessFactor(double rate, double cap) {
        this.rate = rate;
        this.cap = cap;
    }

    public double apply(double units) {
        if (units <= 0) return 0;
        return Math.min(units * rate, cap);
    }
}

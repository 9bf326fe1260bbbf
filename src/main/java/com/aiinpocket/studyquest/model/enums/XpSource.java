package com.aiinpocket.studyquest.model.enums;

/**
 * XP 帳本來源。
 * 只有 ADMIN 與 CORRECTION 允許負數金額。
 */
public enum XpSource {
    SESSION,
    STREAK,
    DAILY_BONUS,
    MILESTONE,
    ACHIEVEMENT,
    ADMIN,
    CORRECTION;

    public boolean allowsNegative() {
        return this == ADMIN || this == CORRECTION;
    }
}

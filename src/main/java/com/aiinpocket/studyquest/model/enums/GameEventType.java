package com.aiinpocket.studyquest.model.enums;

/**
 * 結算流程回傳給呼叫端的領域事件類型（取代全域事件發射器）。
 */
public enum GameEventType {
    XP_GAINED,
    LEVEL_UP,
    XP_MILESTONE,
    STREAK_MILESTONE,
    TIER_PROMOTED,
    TIER_DOWNGRADED,
    BADGE_UNLOCKED,
    AUDIT_FLAGGED
}

package com.aiinpocket.studyquest.model.enums;

/**
 * 結算流程的階段，依執行順序排列。
 */
public enum PipelineStage {
    AUDIT,
    XP,
    STREAK,
    RANKING,
    BADGES
}

package com.aiinpocket.studyquest.model.dto;

/**
 * 等級進度與下一個 XP 里程碑。已超過最後一個里程碑時 nextMilestone 為 null。
 */
public record LevelProgress(
        long totalXp,
        int level,
        long xpIntoLevel,
        long xpToNextLevel,
        double progressPct,
        Long nextMilestone,
        Long xpToNextMilestone
) {}

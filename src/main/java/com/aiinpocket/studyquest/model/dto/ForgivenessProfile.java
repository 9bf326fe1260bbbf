package com.aiinpocket.studyquest.model.dto;

/**
 * 使用者的稽核寬恕明細。total 已受總上限限制。
 */
public record ForgivenessProfile(
        double streakComponent,
        double xpComponent,
        double cleanHistoryComponent,
        double total,
        int cleanSessions,
        int totalSessions,
        double cleanSessionRate
) {
    public static ForgivenessProfile none() {
        return new ForgivenessProfile(0, 0, 0, 0, 0, 0, 0);
    }

    public String message() {
        return String.format("可獲得 %.1f%% 稽核寬恕", total * 100);
    }
}

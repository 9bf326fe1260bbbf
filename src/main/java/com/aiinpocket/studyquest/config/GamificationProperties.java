package com.aiinpocket.studyquest.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneOffset;

/**
 * 遊戲化計分參數（application.yml 的 gamification.* 區塊）。
 * 固定的門檻表放在 enum（Tier、AnomalyType、ForgivenessFactor 等），這裡只放可依環境調整的數值。
 */
@ConfigurationProperties(prefix = "gamification")
public record GamificationProperties(
        XpParams xp,
        StreakParams streak,
        AuditParams audit,
        PipelineParams pipeline
) {
    public record XpParams(
            double ratePerMinute,
            int pomodoroBonus,
            int pomodoroMinutes,
            int dailyGoalBonus,
            int dailyGoalMinutes,
            int maxSessionMinutes
    ) {}

    public record StreakParams(
            String anchorOffset,
            int continuityHours
    ) {
        public ZoneOffset zoneOffset() {
            return ZoneOffset.of(anchorOffset);
        }
    }

    public record AuditParams(
            int payloadMaxBytes,
            int payloadMaxDepth,
            int historyDays,
            int cleanScoreThreshold
    ) {}

    public record PipelineParams(
            int version,
            int maxAttempts,
            long backoffMs,
            int queryTimeoutSeconds
    ) {}
}

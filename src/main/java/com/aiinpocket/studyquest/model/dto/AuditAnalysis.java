package com.aiinpocket.studyquest.model.dto;

import com.aiinpocket.studyquest.model.enums.RiskLevel;

import java.util.List;

/**
 * 事件軌跡分析結果（尚未套用寬恕）。
 */
public record AuditAnalysis(
        int patternScore,
        List<DetectedAnomaly> anomalies,
        RiskLevel risk,
        List<String> recommendations
) {
    /**
     * 懷疑分數 = 100 - patternScore + 每個異常的嚴重度加權，限制在 0~100。
     */
    public int suspicionScore() {
        int score = 100 - patternScore;
        for (DetectedAnomaly anomaly : anomalies) {
            score += anomaly.type().getSeverity().getSuspicionAddend();
        }
        return Math.max(0, Math.min(100, score));
    }
}

package com.aiinpocket.studyquest.model.dto;

import com.aiinpocket.studyquest.model.enums.RiskLevel;
import com.aiinpocket.studyquest.model.enums.ValidationMode;

import java.util.List;

/**
 * 軟性稽核的最終結果。
 * fallback = true 表示分析過程發生內部錯誤，結果為安全預設值（有效、分數 0）。
 */
public record AuditResult(
        boolean valid,
        int baseSuspicionScore,
        int adjustedScore,
        double forgiveness,
        ValidationMode mode,
        RiskLevel risk,
        List<String> anomalies,
        List<String> recommendations,
        String message,
        boolean fallback
) {
    public static AuditResult safeDefault(ValidationMode mode) {
        return new AuditResult(true, 0, 0, 0, mode, RiskLevel.MINIMAL, List.of(), List.of(),
                "本次讀書已記錄", true);
    }

    public boolean flagged() {
        return !valid;
    }
}

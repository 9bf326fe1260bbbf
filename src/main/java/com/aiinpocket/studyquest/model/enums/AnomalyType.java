package com.aiinpocket.studyquest.model.enums;

import lombok.Getter;

/**
 * 軟性稽核的異常樣式計分表。
 * weight 從 patternScore（起始 100）扣除；severity 決定額外的懷疑分數加權。
 * soft / strict 兩種驗證模式共用同一張表，模式只影響最後的通過門檻。
 */
@Getter
public enum AnomalyType {

    LARGE_TIME_GAP(15, Severity.MEDIUM, true),
    EXTENDED_INACTIVITY(25, Severity.HIGH, true),
    MISSING_START(30, Severity.HIGH, false),
    MISSING_END(25, Severity.MEDIUM, false),
    IRREGULAR_HEARTBEAT(20, Severity.MEDIUM, false),
    DUPLICATE_EVENT(10, Severity.MEDIUM, false),
    INVALID_PAYLOAD(10, Severity.MEDIUM, false),
    MULTIPLE_DEVICES(20, Severity.HIGH, false),
    VERY_SHORT_DURATION(10, Severity.LOW, false),
    EXTENDED_DURATION(15, Severity.MEDIUM, false);

    private final int weight;
    private final Severity severity;
    /** true 表示每個發生點各自扣分（例如每一段過長間隔），false 表示整個 session 最多扣一次 */
    private final boolean perOccurrence;

    AnomalyType(int weight, Severity severity, boolean perOccurrence) {
        this.weight = weight;
        this.severity = severity;
        this.perOccurrence = perOccurrence;
    }
}

package com.aiinpocket.studyquest.model.enums;

/**
 * 單一 session 的整體風險評估。
 */
public enum RiskLevel {
    MINIMAL,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}

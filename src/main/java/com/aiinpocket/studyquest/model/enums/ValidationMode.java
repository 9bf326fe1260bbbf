package com.aiinpocket.studyquest.model.enums;

import lombok.Getter;

/**
 * 稽核驗證模式。只改變通過門檻，不改變計分方式。
 */
@Getter
public enum ValidationMode {

    SOFT(75),
    STRICT(25);

    /** 調整後分數必須嚴格小於此值才視為有效 */
    private final int threshold;

    ValidationMode(int threshold) {
        this.threshold = threshold;
    }

    public boolean passes(int adjustedScore) {
        return adjustedScore < threshold;
    }

    public static ValidationMode fromString(String value) {
        if (value == null || value.isBlank()) return SOFT;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("無效的驗證模式: " + value);
        }
    }
}

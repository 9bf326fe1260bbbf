package com.aiinpocket.studyquest.model.enums;

import lombok.Getter;

/**
 * 異常嚴重程度，附帶計算懷疑分數時的加權值。
 */
@Getter
public enum Severity {

    LOW(3),
    MEDIUM(7),
    HIGH(12);

    private final int suspicionAddend;

    Severity(int suspicionAddend) {
        this.suspicionAddend = suspicionAddend;
    }
}

package com.aiinpocket.studyquest.model.dto;

/**
 * 一次 XP 帳本提交前後的累計值。
 */
public record XpCommitResult(long previousTotal, long newTotal) {

    public long gained() {
        return newTotal - previousTotal;
    }
}

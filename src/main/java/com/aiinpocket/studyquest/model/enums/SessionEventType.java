package com.aiinpocket.studyquest.model.enums;

/**
 * 讀書 session 的遙測事件類型。
 */
public enum SessionEventType {
    START,
    HEARTBEAT,
    PAUSE,
    RESUME,
    END,
    AUDIT_CHECK
}

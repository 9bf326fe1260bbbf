package com.aiinpocket.studyquest.model.enums;

/**
 * 結算整體失敗的原因。
 */
public enum SessionErrorType {
    SESSION_NOT_FOUND,
    NO_EVENTS,
    USER_MISMATCH,
    USER_NOT_FOUND,
    DUPLICATE_REQUEST,
    CANCELLED,
    INTERNAL_ERROR
}

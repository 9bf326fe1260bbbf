package com.aiinpocket.studyquest.model.enums;

public enum ProcessingStatus {
    IN_PROGRESS,
    COMPLETED,
    FAILED
}

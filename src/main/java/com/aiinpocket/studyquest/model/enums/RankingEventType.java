package com.aiinpocket.studyquest.model.enums;

public enum RankingEventType {
    PROMOTION,
    DOWNGRADE
}

package com.aiinpocket.studyquest.model.dto;

import com.aiinpocket.studyquest.model.enums.AnomalyType;

public record DetectedAnomaly(AnomalyType type, String detail) {

    @Override
    public String toString() {
        return type.name() + ": " + detail;
    }
}

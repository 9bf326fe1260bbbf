package com.aiinpocket.studyquest.model.dto;

import com.aiinpocket.studyquest.model.enums.GameEventType;

import java.util.Map;
import java.util.UUID;

/**
 * 結算流程產生的領域事件。由呼叫端決定如何派送（寫入待看事件、推播等）。
 */
public record GameEvent(
        GameEventType type,
        UUID userId,
        Map<String, Object> data
) {
    public static GameEvent of(GameEventType type, UUID userId, Map<String, Object> data) {
        return new GameEvent(type, userId, Map.copyOf(data));
    }
}

package com.aiinpocket.studyquest.service.audit;

import com.aiinpocket.studyquest.config.GamificationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * 事件 payload 的邊界驗證。
 * payload 必須是 JSON 物件、UTF-8 位元組數不超過上限、巢狀深度不超過上限；
 * 空 payload 視為空物件。裝置識別取自 {@code device_id} 欄位。
 */
@Component
@Slf4j
public class EventPayloadInspector {

    static final String DEVICE_ID_FIELD = "device_id";

    private final ObjectMapper objectMapper;
    private final int maxBytes;
    private final int maxDepth;

    public EventPayloadInspector(ObjectMapper objectMapper, GamificationProperties properties) {
        this.objectMapper = objectMapper;
        this.maxBytes = properties.audit().payloadMaxBytes();
        this.maxDepth = properties.audit().payloadMaxDepth();
    }

    public PayloadInspection inspect(String payload) {
        if (payload == null || payload.isBlank()) {
            return PayloadInspection.ok(null);
        }
        int size = payload.getBytes(StandardCharsets.UTF_8).length;
        if (size > maxBytes) {
            return PayloadInspection.invalid("payload 大小 " + size + " bytes 超過上限 " + maxBytes);
        }

        Object parsed;
        try {
            parsed = objectMapper.readValue(payload, Object.class);
        } catch (JacksonException e) {
            log.debug("[稽核] payload 無法解析: {}", e.getOriginalMessage());
            return PayloadInspection.invalid("payload 不是合法 JSON");
        }
        if (!(parsed instanceof Map<?, ?> map)) {
            return PayloadInspection.invalid("payload 必須是 JSON 物件");
        }
        int depth = depthOf(map);
        if (depth > maxDepth) {
            return PayloadInspection.invalid("payload 巢狀深度 " + depth + " 超過上限 " + maxDepth);
        }

        Object device = map.get(DEVICE_ID_FIELD);
        return PayloadInspection.ok(device != null ? String.valueOf(device) : null);
    }

    private static int depthOf(Object value) {
        if (value instanceof Map<?, ?> map) {
            int deepest = 0;
            for (Object child : map.values()) {
                deepest = Math.max(deepest, depthOf(child));
            }
            return 1 + deepest;
        }
        if (value instanceof List<?> list) {
            int deepest = 0;
            for (Object child : list) {
                deepest = Math.max(deepest, depthOf(child));
            }
            return 1 + deepest;
        }
        return 0;
    }

    public record PayloadInspection(boolean valid, String reason, String deviceId) {

        static PayloadInspection ok(String deviceId) {
            return new PayloadInspection(true, null, deviceId);
        }

        static PayloadInspection invalid(String reason) {
            return new PayloadInspection(false, reason, null);
        }
    }
}

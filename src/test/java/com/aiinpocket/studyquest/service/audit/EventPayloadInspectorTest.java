package com.aiinpocket.studyquest.service.audit;

import com.aiinpocket.studyquest.service.audit.EventPayloadInspector.PayloadInspection;
import com.aiinpocket.studyquest.support.TestGamificationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import tools.jackson.databind.json.JsonMapper;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EventPayloadInspector")
class EventPayloadInspectorTest {

    private final EventPayloadInspector inspector =
            new EventPayloadInspector(JsonMapper.builder().build(), TestGamificationProperties.defaults());

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("空 payload 視為合法的空物件")
    void blankIsValid(String payload) {
        PayloadInspection inspection = inspector.inspect(payload);

        assertThat(inspection.valid()).isTrue();
        assertThat(inspection.deviceId()).isNull();
    }

    @Test
    @DisplayName("取出 device_id")
    void extractsDeviceId() {
        PayloadInspection inspection = inspector.inspect("{\"device_id\":\"phone-1\",\"battery\":80}");

        assertThat(inspection.valid()).isTrue();
        assertThat(inspection.deviceId()).isEqualTo("phone-1");
    }

    @ParameterizedTest
    @ValueSource(strings = {"not json", "[1,2,3]", "42", "\"text\""})
    @DisplayName("不是 JSON 物件")
    void rejectsNonObjects(String payload) {
        assertThat(inspector.inspect(payload).valid()).isFalse();
    }

    @Test
    @DisplayName("巢狀深度 4 可接受，5 超過上限")
    void depthLimit() {
        assertThat(inspector.inspect("{\"a\":{\"b\":{\"c\":{\"d\":1}}}}").valid()).isTrue();

        PayloadInspection tooDeep = inspector.inspect("{\"a\":{\"b\":{\"c\":{\"d\":{\"e\":1}}}}}");
        assertThat(tooDeep.valid()).isFalse();
        assertThat(tooDeep.reason()).contains("深度 5");
    }

    @Test
    @DisplayName("陣列也計入巢狀深度")
    void arraysCountTowardsDepth() {
        assertThat(inspector.inspect("{\"a\":[[[1]]]}").valid()).isTrue();
        assertThat(inspector.inspect("{\"a\":[[[{\"b\":1}]]]}").valid()).isFalse();
    }

    @Test
    @DisplayName("以 UTF-8 位元組數檢查大小上限")
    void sizeLimitInUtf8Bytes() {
        // 每個中文字 3 bytes，1400 字約 4200 bytes
        String body = "讀".repeat(1400);
        PayloadInspection inspection = inspector.inspect("{\"note\":\"" + body + "\"}");

        assertThat(inspection.valid()).isFalse();
        assertThat(inspection.reason()).contains("超過上限 4096");
    }
}

package com.aiinpocket.studyquest.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("參數錯誤回傳 400 與原始訊息")
    void illegalArgument() {
        ResponseEntity<Map<String, String>> response =
                handler.handleIllegalArgument(new IllegalArgumentException("排行榜筆數必須介於 1 到 100"));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(response.getBody()).containsEntry("error", "排行榜筆數必須介於 1 到 100");
    }

    @Test
    @DisplayName("含有內部細節的訊息會被遮蔽")
    void sanitizesInternalDetails() {
        assertThat(GlobalExceptionHandler.sanitizeMessage("SQL constraint uk_user_badge violated"))
                .isEqualTo("操作失敗，請稍後重試");
        assertThat(GlobalExceptionHandler.sanitizeMessage(null)).isEqualTo("操作失敗，請稍後重試");
        assertThat(GlobalExceptionHandler.sanitizeMessage("x".repeat(201))).isEqualTo("操作失敗，請稍後重試");
    }

    @Test
    @DisplayName("查無資料回傳 404")
    void notFound() {
        ResponseEntity<Map<String, String>> response =
                handler.handleNotFound(new NoSuchElementException("使用者不存在: 123"));

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        assertThat(response.getBody()).containsEntry("error", "資料不存在");
    }

    @Test
    @DisplayName("未預期錯誤回傳 500 與通用訊息")
    void general() {
        ResponseEntity<Map<String, String>> response = handler.handleGeneral(new IllegalStateException("boom"));

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody()).containsEntry("error", "系統發生錯誤，請稍後重試");
    }
}

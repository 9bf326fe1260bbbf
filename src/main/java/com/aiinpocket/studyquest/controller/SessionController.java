package com.aiinpocket.studyquest.controller;

import com.aiinpocket.studyquest.model.dto.ProcessOptions;
import com.aiinpocket.studyquest.model.dto.SessionSummary;
import com.aiinpocket.studyquest.model.enums.ValidationMode;
import com.aiinpocket.studyquest.service.GamificationService;
import com.aiinpocket.studyquest.service.SessionProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * 讀書 session 結算 API。
 * 結算回傳的領域事件在這裡派送到待看事件表。
 */
@RestController
@RequestMapping("/api/users/{userId}/sessions/{sessionId}")
@RequiredArgsConstructor
@Slf4j
public class SessionController {

    private final SessionProcessingService processingService;
    private final GamificationService gamificationService;

    @PostMapping("/process")
    public ResponseEntity<SessionSummary> process(@PathVariable UUID userId,
                                                  @PathVariable UUID sessionId,
                                                  @RequestParam(required = false) String mode,
                                                  @RequestParam(required = false) String deviceId) {
        ProcessOptions options = new ProcessOptions(ValidationMode.fromString(mode), deviceId);
        return respond(processingService.processSession(userId, sessionId, options));
    }

    @PostMapping("/reprocess")
    public ResponseEntity<SessionSummary> reprocess(@PathVariable UUID userId,
                                                    @PathVariable UUID sessionId,
                                                    @RequestParam(required = false) String mode,
                                                    @RequestParam(required = false) String deviceId) {
        ProcessOptions options = new ProcessOptions(ValidationMode.fromString(mode), deviceId);
        return respond(processingService.reprocessSession(userId, sessionId, options));
    }

    // ===== 內部方法 =====

    private ResponseEntity<SessionSummary> respond(SessionSummary summary) {
        if (!summary.events().isEmpty()) {
            try {
                gamificationService.dispatch(summary.events());
            } catch (RuntimeException e) {
                log.warn("[遊戲化] session {} 事件派送失敗: {}", summary.sessionId(), e.getMessage());
            }
        }
        if (summary.success()) {
            return ResponseEntity.ok(summary);
        }
        HttpStatus status = switch (summary.errorType()) {
            case SESSION_NOT_FOUND, USER_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case USER_MISMATCH -> HttpStatus.FORBIDDEN;
            case NO_EVENTS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case DUPLICATE_REQUEST, CANCELLED -> HttpStatus.CONFLICT;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(summary);
    }
}

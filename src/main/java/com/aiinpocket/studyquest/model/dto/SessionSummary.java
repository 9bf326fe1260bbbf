package com.aiinpocket.studyquest.model.dto;

import com.aiinpocket.studyquest.model.enums.PipelineStage;
import com.aiinpocket.studyquest.model.enums.SessionErrorType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 單一 session 結算的彙總結果。結算流程永遠回傳此物件，不會拋出例外。
 *
 * <p>degradedStages：該階段計算失敗，結果以零影響的預設值取代。
 * <p>unpersistedStages：該階段計算成功但寫入失敗（重試用盡），結果仍回傳給呼叫端。
 */
public record SessionSummary(
        boolean success,
        UUID userId,
        UUID sessionId,
        Instant processedAt,
        AuditResult audit,
        XpBreakdown xp,
        StreakResult streak,
        RankingOutcome ranking,
        List<String> badgesUnlocked,
        Notifications notifications,
        List<GameEvent> events,
        List<PipelineStage> degradedStages,
        List<PipelineStage> unpersistedStages,
        SessionErrorType errorType,
        String errorMessage
) {
    public record Notifications(
            boolean xpGained,
            boolean levelUp,
            boolean streakMaintained,
            boolean streakMilestone,
            boolean rankingPromoted,
            boolean confettiTrigger
    ) {
        public static Notifications none() {
            return new Notifications(false, false, false, false, false, false);
        }
    }

    public static SessionSummary failure(UUID userId, UUID sessionId, Instant processedAt,
                                         SessionErrorType errorType, String errorMessage) {
        return new SessionSummary(false, userId, sessionId, processedAt,
                null, null, null, null, List.of(), Notifications.none(), List.of(),
                List.of(), List.of(), errorType, errorMessage);
    }
}

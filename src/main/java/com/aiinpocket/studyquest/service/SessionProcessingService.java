package com.aiinpocket.studyquest.service;

import com.aiinpocket.studyquest.config.GamificationProperties;
import com.aiinpocket.studyquest.gateway.EventStoreGateway;
import com.aiinpocket.studyquest.gateway.GatewayException;
import com.aiinpocket.studyquest.gateway.ProcessingInProgressException;
import com.aiinpocket.studyquest.model.dto.AuditResult;
import com.aiinpocket.studyquest.model.dto.GameEvent;
import com.aiinpocket.studyquest.model.dto.ProcessOptions;
import com.aiinpocket.studyquest.model.dto.RankingOutcome;
import com.aiinpocket.studyquest.model.dto.SessionSummary;
import com.aiinpocket.studyquest.model.dto.SessionSummary.Notifications;
import com.aiinpocket.studyquest.model.dto.StreakResult;
import com.aiinpocket.studyquest.model.dto.UserGameState;
import com.aiinpocket.studyquest.model.dto.XpBreakdown;
import com.aiinpocket.studyquest.model.dto.XpCommitResult;
import com.aiinpocket.studyquest.model.entity.DailyUserMetrics;
import com.aiinpocket.studyquest.model.entity.SessionEvent;
import com.aiinpocket.studyquest.model.entity.StudySession;
import com.aiinpocket.studyquest.model.enums.BadgeDef;
import com.aiinpocket.studyquest.model.enums.GameEventType;
import com.aiinpocket.studyquest.model.enums.PipelineStage;
import com.aiinpocket.studyquest.model.enums.ProcessingStatus;
import com.aiinpocket.studyquest.model.enums.SessionErrorType;
import com.aiinpocket.studyquest.model.enums.Tier;
import com.aiinpocket.studyquest.model.enums.XpMilestone;
import com.aiinpocket.studyquest.service.audit.SoftAuditService;
import com.aiinpocket.studyquest.service.badge.BadgeService;
import com.aiinpocket.studyquest.service.ranking.RankingService;
import com.aiinpocket.studyquest.service.streak.StreakCalculator;
import com.aiinpocket.studyquest.service.streak.StreakService;
import com.aiinpocket.studyquest.service.streak.StreakService.PreSessionStreak;
import com.aiinpocket.studyquest.service.streak.StreakService.StreakBonus;
import com.aiinpocket.studyquest.service.xp.XpCalculator;
import com.aiinpocket.studyquest.service.xp.XpService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session 結算流程。
 * 依序執行 稽核 → XP → 連續天數 → 段位 → 徽章，並彙整成一個 {@link SessionSummary}。
 *
 * <ul>
 *   <li>輸入錯誤（session / 事件 / 使用者不存在）：不做任何寫入，直接回傳失敗</li>
 *   <li>單一階段計算失敗：該階段改用零影響的預設值，列入 degradedStages，流程繼續</li>
 *   <li>單一階段寫入失敗（重試用盡）：計算結果照常回傳，列入 unpersistedStages</li>
 *   <li>同一 (user, session, 流程版本) 同時間只允許一個結算：JVM 內以 in-flight 集合擋下，
 *       跨 Pod 以 session_processing 唯一約束擋下</li>
 *   <li>呼叫端中斷執行緒即視為取消：在階段之間檢查，已提交的階段保持完整</li>
 * </ul>
 * 此服務永遠回傳 SessionSummary，不會拋出例外。
 */
@Service
@Slf4j
public class SessionProcessingService {

    private final EventStoreGateway gateway;
    private final SoftAuditService auditService;
    private final XpService xpService;
    private final StreakService streakService;
    private final StreakCalculator streakCalculator;
    private final RankingService rankingService;
    private final BadgeService badgeService;
    private final Clock clock;
    private final int pipelineVersion;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public SessionProcessingService(EventStoreGateway gateway,
                                    SoftAuditService auditService,
                                    XpService xpService,
                                    StreakService streakService,
                                    StreakCalculator streakCalculator,
                                    RankingService rankingService,
                                    BadgeService badgeService,
                                    Clock clock,
                                    GamificationProperties properties) {
        this.gateway = gateway;
        this.auditService = auditService;
        this.xpService = xpService;
        this.streakService = streakService;
        this.streakCalculator = streakCalculator;
        this.rankingService = rankingService;
        this.badgeService = badgeService;
        this.clock = clock;
        this.pipelineVersion = properties.pipeline().version();
    }

    /**
     * 結算一個已完成的 session。
     */
    public SessionSummary processSession(UUID userId, UUID sessionId, ProcessOptions options) {
        return guarded(userId, sessionId, options, false);
    }

    /**
     * 重新結算：先清除此 session 先前的 XP 帳本、稽核紀錄、當日分鐘數與冪等鍵，再重跑完整流程。
     */
    public SessionSummary reprocessSession(UUID userId, UUID sessionId, ProcessOptions options) {
        return guarded(userId, sessionId, options, true);
    }

    // ===== 流程控制 =====

    private SessionSummary guarded(UUID userId, UUID sessionId, ProcessOptions options, boolean reprocess) {
        String key = userId + ":" + sessionId;
        if (!inFlight.add(key)) {
            log.info("[結算流程] session {} 正在結算中，拒絕重複請求", sessionId);
            return SessionSummary.failure(userId, sessionId, clock.instant(),
                    SessionErrorType.DUPLICATE_REQUEST, "此 session 正在結算中");
        }
        try {
            return execute(userId, sessionId, options != null ? options : ProcessOptions.defaults(), reprocess);
        } catch (RuntimeException e) {
            log.error("[結算流程] session {} 結算失敗", sessionId, e);
            return SessionSummary.failure(userId, sessionId, clock.instant(),
                    SessionErrorType.INTERNAL_ERROR, "結算時發生錯誤，請稍後重試");
        } finally {
            inFlight.remove(key);
        }
    }

    private SessionSummary execute(UUID userId, UUID sessionId, ProcessOptions options, boolean reprocess) {
        Optional<StudySession> found = gateway.fetchSession(sessionId);
        if (found.isEmpty()) {
            return SessionSummary.failure(userId, sessionId, clock.instant(),
                    SessionErrorType.SESSION_NOT_FOUND, "找不到讀書紀錄");
        }
        StudySession session = found.get();
        if (!session.getUserId().equals(userId)) {
            log.warn("[結算流程] session {} 不屬於用戶 {}", sessionId, userId);
            return SessionSummary.failure(userId, sessionId, clock.instant(),
                    SessionErrorType.USER_MISMATCH, "讀書紀錄不屬於此使用者");
        }
        if (gateway.fetchUserStats(userId).isEmpty()) {
            return SessionSummary.failure(userId, sessionId, clock.instant(),
                    SessionErrorType.USER_NOT_FOUND, "使用者不存在");
        }
        List<SessionEvent> events = gateway.fetchEvents(sessionId);
        if (events.isEmpty()) {
            return SessionSummary.failure(userId, sessionId, clock.instant(),
                    SessionErrorType.NO_EVENTS, "這次讀書沒有任何事件紀錄");
        }

        if (reprocess) {
            LocalDate day = streakCalculator.anchorDate(session.getCreatedAt());
            long removed;
            try {
                removed = gateway.resetSessionResults(userId, sessionId, pipelineVersion, day,
                        session.getDurationMinutes());
            } catch (ProcessingInProgressException e) {
                log.info("[結算流程] session {} 仍在其他節點結算中，拒絕重新結算", sessionId);
                return SessionSummary.failure(userId, sessionId, clock.instant(),
                        SessionErrorType.DUPLICATE_REQUEST, "此 session 正在結算中");
            }
            log.info("[結算流程] 重新結算 session {}: 已扣回 {} XP", sessionId, removed);
        }

        if (!gateway.claimProcessing(userId, sessionId, pipelineVersion)) {
            return SessionSummary.failure(userId, sessionId, clock.instant(),
                    SessionErrorType.DUPLICATE_REQUEST, "此 session 已經結算過");
        }

        // 重算時 totalXp 已扣回，重新讀取
        UserGameState user = gateway.fetchUserStats(userId).orElseThrow();
        log.info("[結算流程] 開始結算 session {} (用戶 {}, {} 分鐘, {} 筆事件, 模式 {})",
                sessionId, userId, session.getDurationMinutes(), events.size(), options.mode());

        PipelineRun run = new PipelineRun(userId, sessionId);

        runAudit(run, user, session, events, options);
        if (cancelled()) return cancel(run);

        PreSessionStreak pre = runXp(run, user, session);
        if (cancelled()) return cancel(run);

        runStreak(run, user, session, pre);
        if (cancelled()) return cancel(run);

        UserGameState updated = new UserGameState(userId, user.displayName(), run.currentXp,
                XpCalculator.levelFor(run.currentXp), run.currentStreak, run.bestStreak, user.tier(),
                session.getCreatedAt());
        runRanking(run, updated);
        if (cancelled()) return cancel(run);

        runBadges(run, updated, session);

        ProcessingStatus status = run.unpersisted.isEmpty() ? ProcessingStatus.COMPLETED : ProcessingStatus.FAILED;
        finish(run, status);

        log.info("[結算流程] session {} 結算完成: +{} XP, 連續 {} 天, 段位 {}, 降級階段 {}, 未寫入階段 {}",
                sessionId, run.xp.total(), run.currentStreak, run.ranking.currentTier(),
                run.degraded, run.unpersisted);
        return run.toSummary(true, null, null);
    }

    // ===== 各階段 =====

    private void runAudit(PipelineRun run, UserGameState user, StudySession session, List<SessionEvent> events,
                          ProcessOptions options) {
        AuditResult result = auditService.evaluate(user, session, events, options.mode(), options.expectedDeviceId());
        run.audit = result;
        if (result.fallback()) {
            run.degraded.add(PipelineStage.AUDIT);
        } else {
            try {
                auditService.record(run.userId, run.sessionId, result);
            } catch (RuntimeException e) {
                unpersisted(run, PipelineStage.AUDIT, e);
            }
        }
        if (result.flagged()) {
            run.events.add(GameEvent.of(GameEventType.AUDIT_FLAGGED, run.userId, Map.of(
                    "sessionId", run.sessionId.toString(),
                    "score", result.adjustedScore(),
                    "risk", result.risk().name())));
        }
        stageCompleted(run, PipelineStage.AUDIT);
    }

    private PreSessionStreak runXp(PipelineRun run, UserGameState user, StudySession session) {
        run.currentXp = user.totalXp();
        PreSessionStreak pre;
        XpBreakdown breakdown;
        try {
            pre = streakService.beforeSession(run.userId, session);
            breakdown = xpService.calculate(user, session, pre.streak().multiplier());
        } catch (RuntimeException e) {
            log.warn("[結算流程] session {} XP 計算失敗，改為 0 XP: {}", run.sessionId, e.getMessage());
            run.degraded.add(PipelineStage.XP);
            run.xp = XpBreakdown.none(user.totalXp(), user.level());
            return null;
        }
        run.xp = breakdown;

        try {
            XpCommitResult commit = xpService.commit(run.userId, session, breakdown);
            run.currentXp = commit.newTotal();
        } catch (RuntimeException e) {
            unpersisted(run, PipelineStage.XP, e);
            return pre;
        }

        run.events.add(GameEvent.of(GameEventType.XP_GAINED, run.userId, Map.of(
                "amount", breakdown.total(), "totalXp", run.currentXp)));
        if (breakdown.leveledUp()) {
            run.events.add(GameEvent.of(GameEventType.LEVEL_UP, run.userId, Map.of(
                    "oldLevel", breakdown.previousLevel(), "newLevel", breakdown.newLevel())));
        }
        if (breakdown.milestone500() > 0) {
            run.events.add(milestoneEvent(run.userId, XpMilestone.XP_500));
        }
        if (breakdown.milestone10000() > 0) {
            run.events.add(milestoneEvent(run.userId, XpMilestone.XP_10000));
        }
        stageCompleted(run, PipelineStage.XP);
        return pre;
    }

    private void runStreak(PipelineRun run, UserGameState user, StudySession session, PreSessionStreak pre) {
        run.currentStreak = user.currentStreak();
        run.bestStreak = user.bestStreak();
        StreakResult result;
        try {
            result = streakService.afterSession(user);
        } catch (RuntimeException e) {
            log.warn("[結算流程] session {} 連續天數計算失敗，維持原狀態: {}", run.sessionId, e.getMessage());
            run.degraded.add(PipelineStage.STREAK);
            run.streak = StreakResult.none();
            return;
        }
        run.streak = result;
        run.currentStreak = result.currentStreak();
        run.bestStreak = result.bestStreak();

        try {
            streakService.persist(user, session, result);
            if (pre != null && pre.firstSessionOfDay()) {
                StreakBonus bonus = streakService.awardBonus(run.userId, session, result, run.currentXp);
                if (bonus.awarded()) {
                    run.currentXp = bonus.newTotal();
                    bonus.milestones().forEach(m -> run.events.add(milestoneEvent(run.userId, m)));
                }
            }
        } catch (RuntimeException e) {
            unpersisted(run, PipelineStage.STREAK, e);
            return;
        }

        if (result.milestoneReached() != null) {
            run.events.add(GameEvent.of(GameEventType.STREAK_MILESTONE, run.userId, Map.of(
                    "milestone", result.milestoneReached().key(),
                    "days", result.currentStreak())));
        }
        stageCompleted(run, PipelineStage.STREAK);
    }

    private void runRanking(PipelineRun run, UserGameState updated) {
        RankingOutcome outcome;
        try {
            outcome = rankingService.evaluatePromotion(updated);
        } catch (RuntimeException e) {
            log.warn("[結算流程] session {} 段位計算失敗，維持原段位: {}", run.sessionId, e.getMessage());
            run.degraded.add(PipelineStage.RANKING);
            run.ranking = RankingOutcome.unchanged(updated.tier());
            return;
        }
        run.ranking = outcome;

        try {
            rankingService.applyPromotion(updated, outcome);
        } catch (RuntimeException e) {
            unpersisted(run, PipelineStage.RANKING, e);
            return;
        }

        Tier from = outcome.previousTier();
        for (Tier to : outcome.promotedTo()) {
            run.events.add(GameEvent.of(GameEventType.TIER_PROMOTED, run.userId, Map.of(
                    "fromTier", from.name(), "toTier", to.name())));
            from = to;
        }
        stageCompleted(run, PipelineStage.RANKING);
    }

    private void runBadges(PipelineRun run, UserGameState updated, StudySession session) {
        UserGameState withTier = new UserGameState(updated.userId(), updated.displayName(), updated.totalXp(),
                updated.level(), updated.currentStreak(), updated.bestStreak(), run.ranking.currentTier(),
                updated.lastActivityAt());
        try {
            LocalDate day = streakCalculator.anchorDate(session.getCreatedAt());
            int todayMinutes = gateway.fetchDailyMetrics(run.userId, day)
                    .map(DailyUserMetrics::getTotalMinutes)
                    .orElse(session.getDurationMinutes());
            long sessionCount = gateway.countSessions(run.userId);

            for (BadgeDef badge : badgeService.checkAndUnlock(withTier, todayMinutes, sessionCount)) {
                run.badges.add(badge.name());
                run.events.add(GameEvent.of(GameEventType.BADGE_UNLOCKED, run.userId, Map.of(
                        "key", badge.name(), "name", badge.getDisplayName())));
            }
        } catch (GatewayException e) {
            unpersisted(run, PipelineStage.BADGES, e);
            return;
        } catch (RuntimeException e) {
            log.warn("[結算流程] session {} 徽章檢查失敗: {}", run.sessionId, e.getMessage());
            run.degraded.add(PipelineStage.BADGES);
            return;
        }
        stageCompleted(run, PipelineStage.BADGES);
    }

    // ===== 內部方法 =====

    private static boolean cancelled() {
        return Thread.currentThread().isInterrupted();
    }

    private SessionSummary cancel(PipelineRun run) {
        log.warn("[結算流程] session {} 已被取消，最後完成階段 {}", run.sessionId, run.lastCompleted);
        finish(run, ProcessingStatus.FAILED);
        return run.toSummary(false, SessionErrorType.CANCELLED,
                "結算已取消，最後完成的階段: " + (run.lastCompleted != null ? run.lastCompleted : "無"));
    }

    private void stageCompleted(PipelineRun run, PipelineStage stage) {
        run.lastCompleted = stage;
        try {
            gateway.markStageCompleted(run.userId, run.sessionId, pipelineVersion, stage);
        } catch (RuntimeException e) {
            log.warn("[結算流程] session {} 無法記錄完成階段 {}: {}", run.sessionId, stage, e.getMessage());
        }
    }

    private void finish(PipelineRun run, ProcessingStatus status) {
        try {
            gateway.finishProcessing(run.userId, run.sessionId, pipelineVersion, status);
        } catch (RuntimeException e) {
            log.warn("[結算流程] session {} 無法更新結算狀態 {}: {}", run.sessionId, status, e.getMessage());
        }
    }

    private static void unpersisted(PipelineRun run, PipelineStage stage, RuntimeException e) {
        log.warn("[結算流程] session {} 階段 {} 寫入失敗，結果未保存: {}", run.sessionId, stage, e.getMessage());
        run.unpersisted.add(stage);
    }

    private static GameEvent milestoneEvent(UUID userId, XpMilestone milestone) {
        return GameEvent.of(GameEventType.XP_MILESTONE, userId, Map.of(
                "threshold", milestone.getThreshold(), "reward", milestone.getReward()));
    }

    /**
     * 單次結算的累積狀態。
     */
    private final class PipelineRun {
        final UUID userId;
        final UUID sessionId;
        final List<GameEvent> events = new ArrayList<>();
        final List<PipelineStage> degraded = new ArrayList<>();
        final List<PipelineStage> unpersisted = new ArrayList<>();
        final List<String> badges = new ArrayList<>();
        AuditResult audit;
        XpBreakdown xp;
        StreakResult streak;
        RankingOutcome ranking;
        PipelineStage lastCompleted;
        long currentXp;
        int currentStreak;
        int bestStreak;

        PipelineRun(UUID userId, UUID sessionId) {
            this.userId = userId;
            this.sessionId = sessionId;
        }

        SessionSummary toSummary(boolean success, SessionErrorType errorType, String errorMessage) {
            boolean xpGained = xp != null && xp.total() > 0 && !unpersisted.contains(PipelineStage.XP);
            boolean levelUp = xpGained && xp.leveledUp();
            boolean streakMaintained = streak != null && streak.active();
            boolean streakMilestone = streak != null && streak.milestoneReached() != null;
            boolean promoted = ranking != null && ranking.promoted();
            boolean xpMilestone = xpGained && xp.milestoneTotal() > 0;
            boolean confetti = levelUp || streakMilestone || promoted || xpMilestone || !badges.isEmpty();

            return new SessionSummary(success, userId, sessionId, clock.instant(),
                    audit, xp, streak, ranking, List.copyOf(badges),
                    new Notifications(xpGained, levelUp, streakMaintained, streakMilestone, promoted, confetti),
                    List.copyOf(events), List.copyOf(degraded), List.copyOf(unpersisted),
                    errorType, errorMessage);
        }
    }
}

package com.aiinpocket.studyquest.gateway;

import com.aiinpocket.studyquest.config.ResilienceConfig;
import com.aiinpocket.studyquest.model.dto.UserGameState;
import com.aiinpocket.studyquest.model.dto.UserStatsPatch;
import com.aiinpocket.studyquest.model.dto.XpCommitResult;
import com.aiinpocket.studyquest.model.entity.DailyUserMetrics;
import com.aiinpocket.studyquest.model.entity.RankingEvent;
import com.aiinpocket.studyquest.model.entity.SessionAudit;
import com.aiinpocket.studyquest.model.entity.SessionEvent;
import com.aiinpocket.studyquest.model.entity.StudySession;
import com.aiinpocket.studyquest.model.entity.XpHistoryEntry;
import com.aiinpocket.studyquest.model.enums.PipelineStage;
import com.aiinpocket.studyquest.model.enums.ProcessingStatus;
import com.aiinpocket.studyquest.model.enums.Tier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 為事件儲存的每個呼叫加上有限次數、指數退避的重試。
 * 每次重試都重新進入 JPA 實作的交易代理，因此失敗的嘗試會完整回滾，不會留下半筆資料。
 * 重試用盡的資料存取錯誤轉成 {@link GatewayException}；其他例外（例如找不到使用者）原樣拋出。
 */
@Component
@Primary
@Slf4j
public class RetryingEventStoreGateway implements EventStoreGateway {

    private final EventStoreGateway delegate;
    private final Retry retry;

    public RetryingEventStoreGateway(@Qualifier("jpaEventStoreGateway") EventStoreGateway delegate,
                                     RetryRegistry retryRegistry) {
        this.delegate = delegate;
        this.retry = retryRegistry.retry(ResilienceConfig.EVENT_STORE_RETRY);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("[事件儲存] 第 {} 次重試: {}", event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "-"));
    }

    @Override
    public List<SessionEvent> fetchEvents(UUID sessionId) {
        return call("fetchEvents", () -> delegate.fetchEvents(sessionId));
    }

    @Override
    public Optional<StudySession> fetchSession(UUID sessionId) {
        return call("fetchSession", () -> delegate.fetchSession(sessionId));
    }

    @Override
    public Optional<UserGameState> fetchUserStats(UUID userId) {
        return call("fetchUserStats", () -> delegate.fetchUserStats(userId));
    }

    @Override
    public List<Instant> fetchSessionTimestamps(UUID userId, Instant upTo) {
        return call("fetchSessionTimestamps", () -> delegate.fetchSessionTimestamps(userId, upTo));
    }

    @Override
    public Optional<DailyUserMetrics> fetchDailyMetrics(UUID userId, LocalDate date) {
        return call("fetchDailyMetrics", () -> delegate.fetchDailyMetrics(userId, date));
    }

    @Override
    public List<Integer> fetchRecentAuditScores(UUID userId, Instant since) {
        return call("fetchRecentAuditScores", () -> delegate.fetchRecentAuditScores(userId, since));
    }

    @Override
    public long countSessions(UUID userId) {
        return call("countSessions", () -> delegate.countSessions(userId));
    }

    @Override
    public List<UserGameState> fetchUsersInTiers(Collection<Tier> tiers) {
        return call("fetchUsersInTiers", () -> delegate.fetchUsersInTiers(tiers));
    }

    @Override
    public List<UserGameState> fetchLeaderboardCandidates() {
        return call("fetchLeaderboardCandidates", delegate::fetchLeaderboardCandidates);
    }

    @Override
    public Set<String> fetchUnlockedBadges(UUID userId) {
        return call("fetchUnlockedBadges", () -> delegate.fetchUnlockedBadges(userId));
    }

    @Override
    public Long appendXpEntry(XpHistoryEntry entry) {
        return call("appendXpEntry", () -> delegate.appendXpEntry(entry));
    }

    @Override
    public XpCommitResult commitXpAward(UUID userId, List<XpHistoryEntry> entries, LocalDate metricDate,
                                        int minutes, UUID dailyGoalSessionId) {
        return call("commitXpAward",
                () -> delegate.commitXpAward(userId, entries, metricDate, minutes, dailyGoalSessionId));
    }

    @Override
    public void updateUserStats(UUID userId, UserStatsPatch patch) {
        run("updateUserStats", () -> delegate.updateUserStats(userId, patch));
    }

    @Override
    public void updateRankingState(UUID userId, Tier tier, List<RankingEvent> events) {
        run("updateRankingState", () -> delegate.updateRankingState(userId, tier, events));
    }

    @Override
    public void appendAuditRecord(SessionAudit record) {
        run("appendAuditRecord", () -> delegate.appendAuditRecord(record));
    }

    @Override
    public boolean unlockBadge(UUID userId, String badgeKey) {
        return call("unlockBadge", () -> delegate.unlockBadge(userId, badgeKey));
    }

    @Override
    public boolean claimProcessing(UUID userId, UUID sessionId, int pipelineVersion) {
        return call("claimProcessing", () -> delegate.claimProcessing(userId, sessionId, pipelineVersion));
    }

    @Override
    public void markStageCompleted(UUID userId, UUID sessionId, int pipelineVersion, PipelineStage stage) {
        run("markStageCompleted", () -> delegate.markStageCompleted(userId, sessionId, pipelineVersion, stage));
    }

    @Override
    public void finishProcessing(UUID userId, UUID sessionId, int pipelineVersion, ProcessingStatus status) {
        run("finishProcessing", () -> delegate.finishProcessing(userId, sessionId, pipelineVersion, status));
    }

    @Override
    public long resetSessionResults(UUID userId, UUID sessionId, int pipelineVersion,
                                    LocalDate metricDate, int durationMinutes) {
        return call("resetSessionResults",
                () -> delegate.resetSessionResults(userId, sessionId, pipelineVersion, metricDate, durationMinutes));
    }

    // ===== 內部方法 =====

    private <T> T call(String operation, Supplier<T> supplier) {
        try {
            return Retry.decorateSupplier(retry, supplier).get();
        } catch (DataAccessException e) {
            log.warn("[事件儲存] {} 重試用盡仍失敗: {}", operation, e.getMessage());
            throw new GatewayException(operation, e);
        }
    }

    private void run(String operation, Runnable runnable) {
        call(operation, () -> {
            runnable.run();
            return null;
        });
    }
}

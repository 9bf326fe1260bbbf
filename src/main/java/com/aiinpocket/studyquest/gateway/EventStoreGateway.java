package com.aiinpocket.studyquest.gateway;

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

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 計分核心與資料儲存之間的唯一介面。
 * 計分引擎本身不直接存取 Repository，所有讀寫都經過這裡，方便測試替換與統一重試。
 *
 * <p>寫入方法失敗時拋出 Spring 的 {@code DataAccessException}；
 * 經過重試包裝後，重試用盡的失敗會轉成 {@link GatewayException}。
 */
public interface EventStoreGateway {

    // ===== 讀取 =====

    /** 依 created_at 排序的 session 事件 */
    List<SessionEvent> fetchEvents(UUID sessionId);

    Optional<StudySession> fetchSession(UUID sessionId);

    Optional<UserGameState> fetchUserStats(UUID userId);

    /** 使用者在 upTo（含）以前所有 session 的建立時間，由舊到新 */
    List<Instant> fetchSessionTimestamps(UUID userId, Instant upTo);

    Optional<DailyUserMetrics> fetchDailyMetrics(UUID userId, LocalDate date);

    /** 歷史窗口內的稽核調整後分數 */
    List<Integer> fetchRecentAuditScores(UUID userId, Instant since);

    long countSessions(UUID userId);

    List<UserGameState> fetchUsersInTiers(Collection<Tier> tiers);

    List<UserGameState> fetchLeaderboardCandidates();

    Set<String> fetchUnlockedBadges(UUID userId);

    // ===== XP 帳本 =====

    /**
     * 寫入單筆 XP 帳本並同步累加使用者 totalXp（同一交易）。
     *
     * @return 帳本 ID
     */
    Long appendXpEntry(XpHistoryEntry entry);

    /**
     * 一次提交一個 session 的所有 XP 帳本、使用者 totalXp 與當日統計（同一交易）。
     *
     * @param dailyGoalSessionId 本次拿到每日目標獎勵時傳入 session ID，否則為 null
     */
    XpCommitResult commitXpAward(UUID userId, List<XpHistoryEntry> entries, LocalDate metricDate,
                                 int minutes, UUID dailyGoalSessionId);

    // ===== 使用者狀態 =====

    void updateUserStats(UUID userId, UserStatsPatch patch);

    /**
     * 更新段位並寫入對應的段位變動紀錄（同一交易）。
     */
    void updateRankingState(UUID userId, Tier tier, List<RankingEvent> events);

    // ===== 稽核 =====

    void appendAuditRecord(SessionAudit record);

    // ===== 徽章 =====

    /**
     * @return false 表示已解鎖過
     */
    boolean unlockBadge(UUID userId, String badgeKey);

    // ===== 冪等控制 =====

    /**
     * 以 (userId, sessionId, pipelineVersion) 唯一約束取得結算權。
     *
     * @return false 表示已有相同鍵的結算（進行中或已完成）
     */
    boolean claimProcessing(UUID userId, UUID sessionId, int pipelineVersion);

    void markStageCompleted(UUID userId, UUID sessionId, int pipelineVersion, PipelineStage stage);

    void finishProcessing(UUID userId, UUID sessionId, int pipelineVersion, ProcessingStatus status);

    /**
     * 重算前清除 session 的結算結果：XP 帳本（並從 totalXp 扣回）、稽核紀錄、當日分鐘數與冪等鍵。
     *
     * @return 扣回的 XP
     * @throws ProcessingInProgressException 冪等鍵仍在結算中（未逾時的 IN_PROGRESS）
     */
    long resetSessionResults(UUID userId, UUID sessionId, int pipelineVersion,
                             LocalDate metricDate, int durationMinutes);
}

package com.aiinpocket.studyquest.gateway;

import com.aiinpocket.studyquest.model.dto.UserGameState;
import com.aiinpocket.studyquest.model.dto.UserStatsPatch;
import com.aiinpocket.studyquest.model.dto.XpCommitResult;
import com.aiinpocket.studyquest.model.entity.AppUser;
import com.aiinpocket.studyquest.model.entity.DailyUserMetrics;
import com.aiinpocket.studyquest.model.entity.RankingEvent;
import com.aiinpocket.studyquest.model.entity.SessionAudit;
import com.aiinpocket.studyquest.model.entity.SessionEvent;
import com.aiinpocket.studyquest.model.entity.SessionProcessing;
import com.aiinpocket.studyquest.model.entity.StudySession;
import com.aiinpocket.studyquest.model.entity.UserBadge;
import com.aiinpocket.studyquest.model.entity.XpHistoryEntry;
import com.aiinpocket.studyquest.model.enums.PipelineStage;
import com.aiinpocket.studyquest.model.enums.ProcessingStatus;
import com.aiinpocket.studyquest.model.enums.RankingEventType;
import com.aiinpocket.studyquest.model.enums.Tier;
import com.aiinpocket.studyquest.repository.AppUserRepository;
import com.aiinpocket.studyquest.repository.DailyUserMetricsRepository;
import com.aiinpocket.studyquest.repository.RankingEventRepository;
import com.aiinpocket.studyquest.repository.SessionAuditRepository;
import com.aiinpocket.studyquest.repository.SessionEventRepository;
import com.aiinpocket.studyquest.repository.SessionProcessingRepository;
import com.aiinpocket.studyquest.repository.StudySessionRepository;
import com.aiinpocket.studyquest.repository.UserBadgeRepository;
import com.aiinpocket.studyquest.repository.XpHistoryRepository;
import com.aiinpocket.studyquest.service.xp.XpCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 以 JPA Repository 實作的事件儲存。
 * 交易逾時與查詢逾時由 spring.transaction.default-timeout 與 jakarta.persistence.query.timeout 控制。
 */
@Component("jpaEventStoreGateway")
@RequiredArgsConstructor
@Slf4j
public class JpaEventStoreGateway implements EventStoreGateway {

    /** 超過此時間仍為 IN_PROGRESS 的冪等鍵視為中斷的結算 */
    static final Duration ABANDONED_CLAIM_AFTER = Duration.ofMinutes(10);

    private final AppUserRepository userRepo;
    private final StudySessionRepository sessionRepo;
    private final SessionEventRepository eventRepo;
    private final XpHistoryRepository xpRepo;
    private final SessionAuditRepository auditRepo;
    private final RankingEventRepository rankingEventRepo;
    private final DailyUserMetricsRepository dailyMetricsRepo;
    private final SessionProcessingRepository processingRepo;
    private final UserBadgeRepository badgeRepo;
    private final Clock clock;

    // ===== 讀取 =====

    @Override
    @Transactional(readOnly = true)
    public List<SessionEvent> fetchEvents(UUID sessionId) {
        return eventRepo.findBySessionIdOrderByCreatedAtAscIdAsc(sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StudySession> fetchSession(UUID sessionId) {
        return sessionRepo.findById(sessionId);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserGameState> fetchUserStats(UUID userId) {
        return userRepo.findById(userId).map(JpaEventStoreGateway::toState);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Instant> fetchSessionTimestamps(UUID userId, Instant upTo) {
        return sessionRepo.findCreatedAtByUserIdUpTo(userId, upTo);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DailyUserMetrics> fetchDailyMetrics(UUID userId, LocalDate date) {
        return dailyMetricsRepo.findByUserIdAndMetricDate(userId, date);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Integer> fetchRecentAuditScores(UUID userId, Instant since) {
        return auditRepo.findScoresSince(userId, since);
    }

    @Override
    @Transactional(readOnly = true)
    public long countSessions(UUID userId) {
        return sessionRepo.countByUserId(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserGameState> fetchUsersInTiers(Collection<Tier> tiers) {
        return userRepo.findByTierIn(tiers).stream().map(JpaEventStoreGateway::toState).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserGameState> fetchLeaderboardCandidates() {
        return userRepo.findTop100ByOrderByTotalXpDescCurrentStreakDesc().stream()
                .map(JpaEventStoreGateway::toState)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> fetchUnlockedBadges(UUID userId) {
        return badgeRepo.findByUserIdOrderByUnlockedAtDesc(userId).stream()
                .map(UserBadge::getBadgeKey)
                .collect(Collectors.toSet());
    }

    // ===== XP 帳本 =====

    @Override
    @Transactional
    public Long appendXpEntry(XpHistoryEntry entry) {
        validateAmount(entry);
        AppUser user = lockUser(entry.getUserId());
        XpHistoryEntry saved = xpRepo.save(entry);
        user.setTotalXp(Math.max(0, user.getTotalXp() + entry.getAmount()));
        userRepo.save(user);
        log.debug("[事件儲存] 寫入 XP 帳本: user={}, source={}, amount={}",
                entry.getUserId(), entry.getSource(), entry.getAmount());
        return saved.getId();
    }

    @Override
    @Transactional
    public XpCommitResult commitXpAward(UUID userId, List<XpHistoryEntry> entries, LocalDate metricDate,
                                        int minutes, UUID dailyGoalSessionId) {
        entries.forEach(JpaEventStoreGateway::validateAmount);
        AppUser user = lockUser(userId);
        long previous = user.getTotalXp();
        int gained = entries.stream().mapToInt(XpHistoryEntry::getAmount).sum();

        xpRepo.saveAll(entries);
        user.setTotalXp(previous + gained);
        userRepo.save(user);

        DailyUserMetrics metrics = dailyMetricsRepo.findByUserIdAndMetricDate(userId, metricDate)
                .orElseGet(() -> DailyUserMetrics.builder().userId(userId).metricDate(metricDate).build());
        metrics.setTotalMinutes(metrics.getTotalMinutes() + minutes);
        metrics.setXpEarned(metrics.getXpEarned() + gained);
        if (dailyGoalSessionId != null && metrics.getDailyGoalSessionId() == null) {
            metrics.setDailyGoalSessionId(dailyGoalSessionId);
        }
        dailyMetricsRepo.save(metrics);

        return new XpCommitResult(previous, previous + gained);
    }

    // ===== 使用者狀態 =====

    @Override
    @Transactional
    public void updateUserStats(UUID userId, UserStatsPatch patch) {
        AppUser user = lockUser(userId);
        if (patch.currentStreak() != null) {
            user.setCurrentStreak(patch.currentStreak());
        }
        if (patch.bestStreak() != null) {
            user.setBestStreak(patch.bestStreak());
        }
        if (patch.lastActivityAt() != null) {
            user.setLastActivityAt(patch.lastActivityAt());
        }
        userRepo.save(user);
    }

    @Override
    @Transactional
    public void updateRankingState(UUID userId, Tier tier, List<RankingEvent> events) {
        AppUser user = lockUser(userId);
        Tier locked = user.getTier();
        boolean promotion = tier.isHigherThan(locked);
        boolean downgrade = locked.isHigherThan(tier);

        // 呼叫端的段位可能已過期：晉升只往上、只保留從目前段位接續的階段；降級必須從目前段位出發
        List<RankingEvent> applicable = events.stream()
                .filter(e -> e.getEventType() == RankingEventType.PROMOTION
                        ? promotion && e.getToTier().isHigherThan(locked) && !locked.isHigherThan(e.getFromTier())
                        : downgrade && e.getFromTier() == locked)
                .toList();
        if (applicable.isEmpty()) {
            log.info("[事件儲存] 段位已被其他結算更新，略過: user={}, 目前={}, 要求={}", userId, locked, tier);
            return;
        }

        if (promotion) {
            user.setPromotionCount(user.getPromotionCount() + 1);
        } else {
            user.setDowngradeCount(user.getDowngradeCount() + 1);
        }
        user.setTier(tier);
        userRepo.save(user);
        rankingEventRepo.saveAll(applicable);
    }

    // ===== 稽核 =====

    @Override
    @Transactional
    public void appendAuditRecord(SessionAudit record) {
        auditRepo.save(record);
    }

    // ===== 徽章 =====

    /** 不開交易：唯一約束衝突只影響這一筆，不能讓外層交易被標記為 rollback-only */
    @Override
    public boolean unlockBadge(UUID userId, String badgeKey) {
        if (badgeRepo.existsByUserIdAndBadgeKey(userId, badgeKey)) {
            return false;
        }
        try {
            badgeRepo.saveAndFlush(UserBadge.builder().userId(userId).badgeKey(badgeKey).build());
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("[事件儲存] 徽章已存在: user={}, badge={}", userId, badgeKey);
            return false;
        }
    }

    // ===== 冪等控制 =====

    @Override
    public boolean claimProcessing(UUID userId, UUID sessionId, int pipelineVersion) {
        if (processingRepo.findByUserIdAndSessionIdAndPipelineVersion(userId, sessionId, pipelineVersion).isPresent()) {
            return false;
        }
        try {
            processingRepo.saveAndFlush(SessionProcessing.builder()
                    .userId(userId)
                    .sessionId(sessionId)
                    .pipelineVersion(pipelineVersion)
                    .createdAt(clock.instant())
                    .build());
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("[事件儲存] 冪等鍵衝突，另一個請求已在結算: user={}, session={}", userId, sessionId);
            return false;
        }
    }

    @Override
    @Transactional
    public void markStageCompleted(UUID userId, UUID sessionId, int pipelineVersion, PipelineStage stage) {
        processingRepo.findByUserIdAndSessionIdAndPipelineVersion(userId, sessionId, pipelineVersion)
                .ifPresent(p -> {
                    p.setLastCompletedStage(stage);
                    processingRepo.save(p);
                });
    }

    @Override
    @Transactional
    public void finishProcessing(UUID userId, UUID sessionId, int pipelineVersion, ProcessingStatus status) {
        processingRepo.findByUserIdAndSessionIdAndPipelineVersion(userId, sessionId, pipelineVersion)
                .ifPresent(p -> {
                    p.setStatus(status);
                    p.setCompletedAt(clock.instant());
                    processingRepo.save(p);
                });
    }

    @Override
    @Transactional
    public long resetSessionResults(UUID userId, UUID sessionId, int pipelineVersion,
                                    LocalDate metricDate, int durationMinutes) {
        processingRepo.findKeyForUpdate(userId, sessionId, pipelineVersion)
                .filter(this::isLiveClaim)
                .ifPresent(p -> {
                    throw new ProcessingInProgressException(userId, sessionId);
                });

        AppUser user = lockUser(userId);
        long removed = xpRepo.sumAmountByUserIdAndSessionId(userId, sessionId);
        xpRepo.deleteByUserIdAndSessionId(userId, sessionId);
        user.setTotalXp(Math.max(0, user.getTotalXp() - removed));
        userRepo.save(user);

        int audits = auditRepo.deleteBySessionId(sessionId);

        dailyMetricsRepo.findByUserIdAndMetricDate(userId, metricDate).ifPresent(m -> {
            m.setTotalMinutes(Math.max(0, m.getTotalMinutes() - durationMinutes));
            m.setXpEarned((int) Math.max(0, m.getXpEarned() - removed));
            if (sessionId.equals(m.getDailyGoalSessionId())) {
                m.setDailyGoalSessionId(null);
            }
            dailyMetricsRepo.save(m);
        });

        processingRepo.deleteKey(userId, sessionId, pipelineVersion);
        log.info("[事件儲存] 已清除 session {} 的結算結果: 扣回 {} XP, 刪除 {} 筆稽核", sessionId, removed, audits);
        return removed;
    }

    // ===== 內部方法 =====

    /** IN_PROGRESS 且未逾時的冪等鍵；逾時的視為中斷的結算，允許重算接手 */
    private boolean isLiveClaim(SessionProcessing p) {
        return p.getStatus() == ProcessingStatus.IN_PROGRESS
                && p.getCreatedAt() != null
                && p.getCreatedAt().plus(ABANDONED_CLAIM_AFTER).isAfter(clock.instant());
    }

    private AppUser lockUser(UUID userId) {
        return userRepo.findByIdForUpdate(userId)
                .orElseThrow(() -> new NoSuchElementException("使用者不存在: " + userId));
    }

    private static void validateAmount(XpHistoryEntry entry) {
        if (entry.getAmount() < 0 && !entry.getSource().allowsNegative()) {
            throw new IllegalArgumentException("XP 來源 " + entry.getSource() + " 不允許負數: " + entry.getAmount());
        }
    }

    static UserGameState toState(AppUser user) {
        return new UserGameState(
                user.getId(),
                user.getDisplayName(),
                user.getTotalXp(),
                XpCalculator.levelFor(user.getTotalXp()),
                user.getCurrentStreak(),
                user.getBestStreak(),
                user.getTier(),
                user.getLastActivityAt()
        );
    }
}

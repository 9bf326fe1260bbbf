package com.aiinpocket.studyquest.service.ranking;

import com.aiinpocket.studyquest.config.CacheConfig;
import com.aiinpocket.studyquest.gateway.EventStoreGateway;
import com.aiinpocket.studyquest.model.dto.GameEvent;
import com.aiinpocket.studyquest.model.dto.LeaderboardEntry;
import com.aiinpocket.studyquest.model.dto.RankingOutcome;
import com.aiinpocket.studyquest.model.dto.RankingStatus;
import com.aiinpocket.studyquest.model.dto.UserGameState;
import com.aiinpocket.studyquest.model.entity.RankingEvent;
import com.aiinpocket.studyquest.model.enums.GameEventType;
import com.aiinpocket.studyquest.model.enums.RankingEventType;
import com.aiinpocket.studyquest.model.enums.Tier;
import com.aiinpocket.studyquest.service.GamificationService;
import com.aiinpocket.studyquest.service.streak.StreakService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * 段位服務：晉升檢查、閒置降級、段位狀態與排行榜。
 * 晉升只在明確呼叫 {@link #checkAndPromote} 時發生，不會在每次加 XP 時自動觸發。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankingService {

    private final RankingEngine engine;
    private final EventStoreGateway gateway;
    private final StreakService streakService;
    private final GamificationService gamificationService;
    private final Clock clock;

    /**
     * 檢查並執行晉升（逐階，每一階一筆 PROMOTION 紀錄）。已是最高可達段位時為 no-op。
     */
    public RankingOutcome checkAndPromote(UserGameState user) {
        RankingOutcome outcome = evaluatePromotion(user);
        applyPromotion(user, outcome);
        return outcome;
    }

    /**
     * 只計算晉升結果，不寫入。
     */
    public RankingOutcome evaluatePromotion(UserGameState user) {
        Tier current = user.tier();
        List<Tier> path = engine.promotionPath(current, user.totalXp(), user.currentStreak());
        if (path.isEmpty()) {
            return RankingOutcome.unchanged(current);
        }
        return new RankingOutcome(current, path.get(path.size() - 1), List.copyOf(path), false);
    }

    /**
     * 寫入晉升結果：段位與每一階的 PROMOTION 紀錄在同一個交易內提交。
     */
    public void applyPromotion(UserGameState user, RankingOutcome outcome) {
        if (!outcome.promoted()) {
            return;
        }
        List<RankingEvent> events = new ArrayList<>();
        Tier from = outcome.previousTier();
        for (Tier to : outcome.promotedTo()) {
            events.add(RankingEvent.builder()
                    .userId(user.userId())
                    .eventType(RankingEventType.PROMOTION)
                    .fromTier(from)
                    .toTier(to)
                    .reason(String.format("XP %d ≥ %d 且連續 %d 天 ≥ %d",
                            user.totalXp(), from.getPromotionXp(), user.currentStreak(), from.getPromotionStreak()))
                    .createdAt(clock.instant())
                    .build());
            from = to;
        }
        gateway.updateRankingState(user.userId(), outcome.currentTier(), events);
        log.info("[排名] 用戶 {} 晉升: {} → {}", user.userId(), outcome.previousTier(), outcome.currentTier());
    }

    public RankingOutcome checkAndPromote(UUID userId) {
        return checkAndPromote(requireUser(userId));
    }

    /**
     * 閒置降級檢查。連續天數以現在時間重新判定，閒置期間中斷的連續天數不會讓段位繼續被保留。
     */
    public RankingOutcome applyDowngradeIfInactive(UUID userId) {
        return applyDowngradeIfInactive(requireUser(userId));
    }

    public RankingOutcome applyDowngradeIfInactive(UserGameState user) {
        Tier current = user.tier();
        if (!current.canDowngrade() || user.lastActivityAt() == null) {
            return RankingOutcome.unchanged(current);
        }
        Instant now = clock.instant();
        long inactiveDays = ChronoUnit.DAYS.between(user.lastActivityAt(), now);
        int liveStreak = streakService.afterSession(user).currentStreak();

        Optional<Tier> target = engine.downgradeTarget(current, user.totalXp(), liveStreak, inactiveDays);
        if (target.isEmpty()) {
            return RankingOutcome.unchanged(current);
        }

        Tier to = target.get();
        RankingEvent event = RankingEvent.builder()
                .userId(user.userId())
                .eventType(RankingEventType.DOWNGRADE)
                .fromTier(current)
                .toTier(to)
                .reason(String.format("閒置 %d 天超過 %s 門檻 %d 天", inactiveDays, current.getDisplayName(),
                        current.getInactivityDays()))
                .createdAt(now)
                .build();
        gateway.updateRankingState(user.userId(), to, List.of(event));

        log.info("[排名] 用戶 {} 閒置 {} 天降級: {} → {}", user.userId(), inactiveDays, current, to);
        notifyDowngrade(user.userId(), current, to, inactiveDays);
        return new RankingOutcome(current, to, List.of(), true);
    }

    /**
     * 對所有非 BRONZE 使用者執行閒置降級檢查。單一使用者失敗不影響其他人。
     *
     * @return 降級人數
     */
    public int processDowngrades() {
        List<UserGameState> candidates = gateway.fetchUsersInTiers(EnumSet.complementOf(EnumSet.of(Tier.BRONZE)));
        int downgraded = 0;
        for (UserGameState user : candidates) {
            try {
                if (applyDowngradeIfInactive(user).downgraded()) {
                    downgraded++;
                }
            } catch (RuntimeException e) {
                log.warn("[排名] 用戶 {} 降級檢查失敗: {}", user.userId(), e.getMessage());
            }
        }
        log.info("[排名] 降級檢查完成: 檢查 {} 人, 降級 {} 人", candidates.size(), downgraded);
        return downgraded;
    }

    public RankingStatus getRankingStatus(UUID userId) {
        UserGameState user = requireUser(userId);
        Tier tier = user.tier();
        Tier next = tier.next().orElse(null);
        return new RankingStatus(
                user.userId(),
                tier,
                tier.getDisplayName(),
                tier.getEmoji(),
                tier.getColor(),
                user.totalXp(),
                user.currentStreak(),
                next,
                next != null ? tier.getPromotionXp() : 0,
                next != null ? tier.getPromotionStreak() : 0,
                engine.progressToNext(tier, user.totalXp(), user.currentStreak()),
                engine.compositeScore(user.totalXp(), user.currentStreak()),
                engine.nextMilestones(tier, user.totalXp(), user.currentStreak())
        );
    }

    /**
     * 排行榜：依綜合分數排序，同分再比 XP。
     */
    @Cacheable(CacheConfig.LEADERBOARD_CACHE)
    public List<LeaderboardEntry> getLeaderboard(int limit) {
        List<UserGameState> sorted = gateway.fetchLeaderboardCandidates().stream()
                .sorted(Comparator
                        .comparingDouble((UserGameState u) -> engine.compositeScore(u.totalXp(), u.currentStreak()))
                        .reversed()
                        .thenComparing(Comparator.comparingLong(UserGameState::totalXp).reversed()))
                .limit(limit)
                .toList();

        List<LeaderboardEntry> entries = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            UserGameState u = sorted.get(i);
            entries.add(new LeaderboardEntry(i + 1, u.userId(), u.displayName(), u.tier(), u.totalXp(),
                    u.level(), u.currentStreak(), engine.compositeScore(u.totalXp(), u.currentStreak())));
        }
        return entries;
    }

    // ===== 內部方法 =====

    private void notifyDowngrade(UUID userId, Tier from, Tier to, long inactiveDays) {
        try {
            gamificationService.dispatch(List.of(GameEvent.of(GameEventType.TIER_DOWNGRADED, userId, Map.of(
                    "fromTier", from.name(), "toTier", to.name(), "inactiveDays", inactiveDays))));
        } catch (RuntimeException e) {
            log.warn("[排名] 用戶 {} 降級通知寫入失敗: {}", userId, e.getMessage());
        }
    }

    private UserGameState requireUser(UUID userId) {
        return gateway.fetchUserStats(userId)
                .orElseThrow(() -> new NoSuchElementException("使用者不存在: " + userId));
    }
}

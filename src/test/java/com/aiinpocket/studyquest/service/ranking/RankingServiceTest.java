package com.aiinpocket.studyquest.service.ranking;

import com.aiinpocket.studyquest.gateway.EventStoreGateway;
import com.aiinpocket.studyquest.model.dto.LeaderboardEntry;
import com.aiinpocket.studyquest.model.dto.RankingOutcome;
import com.aiinpocket.studyquest.model.dto.RankingStatus;
import com.aiinpocket.studyquest.model.dto.StreakResult;
import com.aiinpocket.studyquest.model.dto.UserGameState;
import com.aiinpocket.studyquest.model.entity.RankingEvent;
import com.aiinpocket.studyquest.model.enums.GameEventType;
import com.aiinpocket.studyquest.model.enums.RankingEventType;
import com.aiinpocket.studyquest.model.enums.Tier;
import com.aiinpocket.studyquest.service.GamificationService;
import com.aiinpocket.studyquest.service.streak.StreakCalculator;
import com.aiinpocket.studyquest.service.streak.StreakService;
import com.aiinpocket.studyquest.service.xp.XpCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RankingService")
class RankingServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-20T12:00:00Z");

    @Mock
    private EventStoreGateway gateway;

    @Mock
    private StreakService streakService;

    @Mock
    private GamificationService gamificationService;

    private RankingService service;

    @BeforeEach
    void setUp() {
        service = new RankingService(new RankingEngine(), gateway, streakService, gamificationService,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static UserGameState user(Tier tier, long xp, int streak, Instant lastActivity) {
        return new UserGameState(UUID.randomUUID(), "learner", xp, XpCalculator.levelFor(xp), streak, streak,
                tier, lastActivity);
    }

    private static StreakResult liveStreak(int current) {
        return new StreakResult(current, current, StreakCalculator.multiplierFor(current), 0, null);
    }

    @Nested
    @DisplayName("晉升")
    class Promotion {

        @SuppressWarnings("unchecked")
        @Test
        @DisplayName("逐階晉升，每一階一筆 PROMOTION 紀錄並與段位一起寫入")
        void promotesStepwiseWithOneEventPerStep() {
            UserGameState user = user(Tier.BRONZE, 6000, 20, NOW);

            RankingOutcome outcome = service.checkAndPromote(user);

            assertThat(outcome.promotedTo()).containsExactly(Tier.SILVER, Tier.GOLD, Tier.PLATINUM);
            assertThat(outcome.currentTier()).isEqualTo(Tier.PLATINUM);

            ArgumentCaptor<List<RankingEvent>> captor = ArgumentCaptor.forClass(List.class);
            verify(gateway).updateRankingState(eq(user.userId()), eq(Tier.PLATINUM), captor.capture());
            List<RankingEvent> events = captor.getValue();
            assertThat(events).extracting(RankingEvent::getFromTier)
                    .containsExactly(Tier.BRONZE, Tier.SILVER, Tier.GOLD);
            assertThat(events).extracting(RankingEvent::getToTier)
                    .containsExactly(Tier.SILVER, Tier.GOLD, Tier.PLATINUM);
            assertThat(events).allMatch(e -> e.getEventType() == RankingEventType.PROMOTION);
        }

        @Test
        @DisplayName("條件不足時不寫入任何東西")
        void noPromotionNoWrite() {
            RankingOutcome outcome = service.checkAndPromote(user(Tier.BRONZE, 600, 2, NOW));

            assertThat(outcome.changed()).isFalse();
            verify(gateway, never()).updateRankingState(any(), any(), anyList());
        }

        @Test
        @DisplayName("以 ID 檢查時使用者不存在")
        void unknownUser() {
            UUID id = UUID.randomUUID();
            when(gateway.fetchUserStats(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.checkAndPromote(id)).isInstanceOf(NoSuchElementException.class);
        }
    }

    @Nested
    @DisplayName("閒置降級")
    class Downgrade {

        @Test
        @DisplayName("以即時連續天數重新判定：記錄中的連續天數已過期")
        void usesLiveStreak() {
            UserGameState user = user(Tier.GOLD, 3000, 8, NOW.minus(Duration.ofDays(11)));
            when(streakService.afterSession(user)).thenReturn(liveStreak(0));

            RankingOutcome outcome = service.applyDowngradeIfInactive(user);

            assertThat(outcome.downgraded()).isTrue();
            assertThat(outcome.currentTier()).isEqualTo(Tier.BRONZE);
            verify(gateway).updateRankingState(eq(user.userId()), eq(Tier.BRONZE),
                    argThat(events -> events.size() == 1
                            && events.get(0).getEventType() == RankingEventType.DOWNGRADE
                            && events.get(0).getFromTier() == Tier.GOLD));
            verify(gamificationService).dispatch(argThat(events -> events.size() == 1
                    && events.get(0).type() == GameEventType.TIER_DOWNGRADED));
        }

        @Test
        @DisplayName("閒置天數未超過門檻不降級")
        void withinThreshold() {
            UserGameState user = user(Tier.GOLD, 3000, 0, NOW.minus(Duration.ofDays(10)));
            when(streakService.afterSession(user)).thenReturn(liveStreak(0));

            assertThat(service.applyDowngradeIfInactive(user).downgraded()).isFalse();
            verify(gateway, never()).updateRankingState(any(), any(), anyList());
        }

        @Test
        @DisplayName("BRONZE 或沒有活動紀錄時直接略過")
        void skipsBronzeAndNeverActive() {
            assertThat(service.applyDowngradeIfInactive(user(Tier.BRONZE, 0, 0, null)).changed()).isFalse();
            assertThat(service.applyDowngradeIfInactive(user(Tier.SILVER, 600, 0, null)).changed()).isFalse();
            verifyNoInteractions(streakService, gateway, gamificationService);
        }

        @Test
        @DisplayName("批次降級：單一使用者失敗不影響其他人")
        void batchContinuesAfterFailure() {
            UserGameState broken = user(Tier.SILVER, 600, 3, NOW.minus(Duration.ofDays(30)));
            UserGameState idle = user(Tier.PLATINUM, 2500, 5, NOW.minus(Duration.ofDays(20)));
            when(gateway.fetchUsersInTiers(any())).thenReturn(List.of(broken, idle));
            when(streakService.afterSession(broken)).thenThrow(new QueryTimeoutException("slow"));
            when(streakService.afterSession(idle)).thenReturn(liveStreak(0));

            int downgraded = service.processDowngrades();

            assertThat(downgraded).isEqualTo(1);
            verify(gateway).updateRankingState(eq(idle.userId()), eq(Tier.BRONZE), anyList());
        }
    }

    @Test
    @DisplayName("段位狀態")
    void rankingStatus() {
        UserGameState user = user(Tier.BRONZE, 250, 1, NOW);
        when(gateway.fetchUserStats(user.userId())).thenReturn(Optional.of(user));

        RankingStatus status = service.getRankingStatus(user.userId());

        assertThat(status.tierName()).isEqualTo("Bronze");
        assertThat(status.nextTier()).isEqualTo(Tier.SILVER);
        assertThat(status.xpRequired()).isEqualTo(500);
        assertThat(status.streakRequired()).isEqualTo(3);
        assertThat(status.progressPct()).isEqualTo(45.0);
        assertThat(status.nextMilestones()).isNotEmpty();
    }

    @Test
    @DisplayName("排行榜依綜合分數排序並截斷")
    void leaderboard() {
        UserGameState steady = user(Tier.GOLD, 4000, 30, NOW);
        UserGameState grinder = user(Tier.SILVER, 6000, 0, NOW);
        UserGameState beginner = user(Tier.BRONZE, 100, 1, NOW);
        when(gateway.fetchLeaderboardCandidates()).thenReturn(List.of(beginner, grinder, steady));

        List<LeaderboardEntry> board = service.getLeaderboard(2);

        assertThat(board).extracting(LeaderboardEntry::userId).containsExactly(steady.userId(), grinder.userId());
        assertThat(board).extracting(LeaderboardEntry::rank).containsExactly(1, 2);
    }
}

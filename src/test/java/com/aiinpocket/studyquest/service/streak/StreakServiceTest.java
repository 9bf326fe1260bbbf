package com.aiinpocket.studyquest.service.streak;

import com.aiinpocket.studyquest.gateway.EventStoreGateway;
import com.aiinpocket.studyquest.model.dto.StreakResult;
import com.aiinpocket.studyquest.model.dto.UserGameState;
import com.aiinpocket.studyquest.model.dto.UserStatsPatch;
import com.aiinpocket.studyquest.model.dto.XpCommitResult;
import com.aiinpocket.studyquest.model.entity.StudySession;
import com.aiinpocket.studyquest.model.entity.XpHistoryEntry;
import com.aiinpocket.studyquest.model.enums.Tier;
import com.aiinpocket.studyquest.model.enums.XpMilestone;
import com.aiinpocket.studyquest.model.enums.XpSource;
import com.aiinpocket.studyquest.service.streak.StreakService.PreSessionStreak;
import com.aiinpocket.studyquest.service.streak.StreakService.StreakBonus;
import com.aiinpocket.studyquest.support.TestGamificationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.json.JsonMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("StreakService")
class StreakServiceTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000003");
    private static final Instant SESSION_TIME = Instant.parse("2026-03-02T06:00:00Z");
    private static final Instant NOW = SESSION_TIME.plus(Duration.ofMinutes(10));

    @Mock
    private EventStoreGateway gateway;

    private StreakService service;

    private final StudySession session = StudySession.builder()
            .id(UUID.randomUUID()).userId(USER_ID).durationMinutes(30).createdAt(SESSION_TIME).build();

    @BeforeEach
    void setUp() {
        service = new StreakService(new StreakCalculator(TestGamificationProperties.defaults()), gateway,
                JsonMapper.builder().build(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static UserGameState user(int best, Instant lastActivity) {
        return new UserGameState(USER_ID, "learner", 0, 1, 0, best, Tier.BRONZE, lastActivity);
    }

    @Test
    @DisplayName("結算前的連續天數不含這次 session，並判斷是否為當天第一次")
    void beforeSessionExcludesCurrent() {
        Instant yesterday = SESSION_TIME.minus(Duration.ofDays(1));
        when(gateway.fetchSessionTimestamps(USER_ID, SESSION_TIME)).thenReturn(List.of(yesterday, SESSION_TIME));

        PreSessionStreak pre = service.beforeSession(USER_ID, session);

        assertThat(pre.streak().currentStreak()).isEqualTo(1);
        assertThat(pre.streak().multiplier()).isEqualTo(1.1);
        assertThat(pre.firstSessionOfDay()).isTrue();
    }

    @Test
    @DisplayName("當天已有其他 session 時不是第一次")
    void notFirstSessionOfDay() {
        Instant earlier = SESSION_TIME.minus(Duration.ofHours(2));
        when(gateway.fetchSessionTimestamps(USER_ID, SESSION_TIME)).thenReturn(List.of(earlier, SESSION_TIME));

        assertThat(service.beforeSession(USER_ID, session).firstSessionOfDay()).isFalse();
    }

    @Test
    @DisplayName("結算後以現在時間判定，含這次 session")
    void afterSessionIncludesCurrent() {
        Instant yesterday = SESSION_TIME.minus(Duration.ofDays(1));
        when(gateway.fetchSessionTimestamps(USER_ID, NOW)).thenReturn(List.of(yesterday, SESSION_TIME));

        StreakResult result = service.afterSession(user(0, yesterday));

        assertThat(result.currentStreak()).isEqualTo(2);
        assertThat(result.bestStreak()).isEqualTo(2);
    }

    @Test
    @DisplayName("最後活動時間只往後推")
    void lastActivityNeverMovesBackwards() {
        Instant later = SESSION_TIME.plus(Duration.ofMinutes(5));

        service.persist(user(1, later), session, new StreakResult(1, 1, 1.1, 0, null));

        verify(gateway).updateUserStats(USER_ID, UserStatsPatch.streak(1, 1, later));
    }

    @Test
    @DisplayName("連續天數獎勵寫入 STREAK 帳本，計入 session 所屬日的統計")
    @SuppressWarnings("unchecked")
    void awardsBonus() {
        when(gateway.commitXpAward(eq(USER_ID), anyList(), eq(LocalDate.of(2026, 3, 2)), eq(0), isNull()))
                .thenReturn(new XpCommitResult(120, 122));

        StreakBonus bonus = service.awardBonus(USER_ID, session, new StreakResult(7, 7, 1.7, 2, null), 120);

        assertThat(bonus.bonusXp()).isEqualTo(2);
        assertThat(bonus.milestones()).isEmpty();
        assertThat(bonus.newTotal()).isEqualTo(122);
        ArgumentCaptor<List<XpHistoryEntry>> captor = ArgumentCaptor.forClass(List.class);
        verify(gateway).commitXpAward(eq(USER_ID), captor.capture(), any(), eq(0), isNull());
        XpHistoryEntry entry = captor.getValue().get(0);
        assertThat(captor.getValue()).hasSize(1);
        assertThat(entry.getSource()).isEqualTo(XpSource.STREAK);
        assertThat(entry.getAmount()).isEqualTo(2);
        assertThat(entry.getSessionId()).isEqualTo(session.getId());
        assertThat(entry.getMetadata()).isEqualTo("{\"streak\":7}");
    }

    @Test
    @DisplayName("獎勵跨過 500 XP 時同一次提交發放里程碑")
    @SuppressWarnings("unchecked")
    void bonusCrossingMilestonePaysIt() {
        when(gateway.commitXpAward(eq(USER_ID), anyList(), any(), eq(0), isNull()))
                .thenReturn(new XpCommitResult(495, 601));

        StreakBonus bonus = service.awardBonus(USER_ID, session, new StreakResult(21, 21, 2.0, 6, null), 495);

        assertThat(bonus.milestones()).containsExactly(XpMilestone.XP_500);
        assertThat(bonus.milestoneXp()).isEqualTo(100);
        assertThat(bonus.newTotal()).isEqualTo(601);
        ArgumentCaptor<List<XpHistoryEntry>> captor = ArgumentCaptor.forClass(List.class);
        verify(gateway).commitXpAward(eq(USER_ID), captor.capture(), any(), eq(0), isNull());
        assertThat(captor.getValue()).extracting(XpHistoryEntry::getSource, XpHistoryEntry::getAmount)
                .containsExactly(tuple(XpSource.STREAK, 6), tuple(XpSource.MILESTONE, 100));
    }

    @Test
    @DisplayName("已超過門檻時獎勵不再觸發里程碑")
    void noMilestoneWhenAlreadyPast() {
        when(gateway.commitXpAward(eq(USER_ID), anyList(), any(), eq(0), isNull()))
                .thenReturn(new XpCommitResult(501, 507));

        StreakBonus bonus = service.awardBonus(USER_ID, session, new StreakResult(21, 21, 2.0, 6, null), 501);

        assertThat(bonus.milestones()).isEmpty();
    }

    @Test
    @DisplayName("沒有獎勵時不寫入")
    void noBonusNoWrite() {
        StreakBonus bonus = service.awardBonus(USER_ID, session, new StreakResult(3, 3, 1.3, 0, null), 495);

        assertThat(bonus.awarded()).isFalse();
        verify(gateway, never()).commitXpAward(any(), anyList(), any(), anyInt(), any());
    }
}

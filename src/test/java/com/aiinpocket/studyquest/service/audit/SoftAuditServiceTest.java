package com.aiinpocket.studyquest.service.audit;

import com.aiinpocket.studyquest.gateway.EventStoreGateway;
import com.aiinpocket.studyquest.model.dto.AuditResult;
import com.aiinpocket.studyquest.model.dto.ForgivenessProfile;
import com.aiinpocket.studyquest.model.dto.UserGameState;
import com.aiinpocket.studyquest.model.entity.SessionAudit;
import com.aiinpocket.studyquest.model.entity.SessionEvent;
import com.aiinpocket.studyquest.model.entity.StudySession;
import com.aiinpocket.studyquest.model.enums.RiskLevel;
import com.aiinpocket.studyquest.model.enums.Tier;
import com.aiinpocket.studyquest.model.enums.ValidationMode;
import com.aiinpocket.studyquest.support.TestGamificationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import tools.jackson.databind.json.JsonMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

import static com.aiinpocket.studyquest.model.enums.SessionEventType.HEARTBEAT;
import static com.aiinpocket.studyquest.service.audit.SessionEventFixtures.SESSION_ID;
import static com.aiinpocket.studyquest.service.audit.SessionEventFixtures.USER_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SoftAuditService")
class SoftAuditServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    @Mock
    private EventStoreGateway gateway;

    private SoftAuditService service;

    private final StudySession session = StudySession.builder()
            .id(SESSION_ID)
            .userId(USER_ID)
            .durationMinutes(30)
            .createdAt(NOW.minus(Duration.ofHours(1)))
            .build();

    @BeforeEach
    void setUp() {
        JsonMapper mapper = JsonMapper.builder().build();
        SessionAuditAnalyzer analyzer = new SessionAuditAnalyzer(
                new EventPayloadInspector(mapper, TestGamificationProperties.defaults()));
        service = new SoftAuditService(analyzer, new ForgivenessCalculator(), gateway, mapper,
                Clock.fixed(NOW, ZoneOffset.UTC), TestGamificationProperties.defaults());
    }

    private static UserGameState user(int streak, long totalXp) {
        return new UserGameState(USER_ID, "Mira", totalXp, 1, streak, streak, Tier.BRONZE, null);
    }

    private static List<SessionEvent> heartbeatsOnly() {
        SessionEventFixtures trail = SessionEventFixtures.trail();
        for (int m = 0; m < 10; m++) {
            trail.at(m, HEARTBEAT);
        }
        return trail.build();
    }

    private static List<Integer> cleanHistory() {
        List<Integer> scores = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            scores.add(5);
        }
        return scores;
    }

    @Nested
    @DisplayName("寬恕與模式門檻")
    class Evaluate {

        @Test
        @DisplayName("新用戶的可疑軌跡：100 分，soft 模式也標記待複查")
        void newUserIsFlagged() {
            when(gateway.fetchRecentAuditScores(eq(USER_ID), any())).thenReturn(List.of());

            AuditResult result = service.evaluate(user(0, 0), session, heartbeatsOnly(), ValidationMode.SOFT, null);

            assertThat(result.baseSuspicionScore()).isEqualTo(100);
            assertThat(result.adjustedScore()).isEqualTo(100);
            assertThat(result.valid()).isFalse();
            assertThat(result.flagged()).isTrue();
            assertThat(result.risk()).isEqualTo(RiskLevel.HIGH);
            assertThat(result.fallback()).isFalse();
        }

        @Test
        @DisplayName("老用戶同樣軌跡套用 60% 寬恕：40 分，soft 通過、strict 不通過")
        void veteranIsForgiven() {
            when(gateway.fetchRecentAuditScores(eq(USER_ID), any())).thenReturn(cleanHistory());

            AuditResult soft = service.evaluate(user(60, 6000), session, heartbeatsOnly(), ValidationMode.SOFT, null);
            AuditResult strict = service.evaluate(user(60, 6000), session, heartbeatsOnly(), ValidationMode.STRICT, null);

            assertThat(soft.forgiveness()).isEqualTo(0.6);
            assertThat(soft.adjustedScore()).isEqualTo(40);
            assertThat(soft.valid()).isTrue();
            assertThat(strict.adjustedScore()).isEqualTo(40);
            assertThat(strict.valid()).isFalse();
            assertThat(soft.message()).contains("60.0%");
        }

        @Test
        @DisplayName("乾淨軌跡直接通過")
        void cleanTrailPasses() {
            when(gateway.fetchRecentAuditScores(eq(USER_ID), any())).thenReturn(List.of());

            AuditResult result = service.evaluate(user(0, 0), session, SessionEventFixtures.clean(30),
                    ValidationMode.STRICT, null);

            assertThat(result.valid()).isTrue();
            assertThat(result.adjustedScore()).isZero();
            assertThat(result.anomalies()).isEmpty();
        }

        @Test
        @DisplayName("歷史讀取失敗時乾淨紀錄寬恕以 0 計算，其餘照常")
        void historyFailureDropsCleanComponent() {
            when(gateway.fetchRecentAuditScores(eq(USER_ID), any())).thenThrow(new QueryTimeoutException("slow"));

            AuditResult result = service.evaluate(user(1, 0), session, heartbeatsOnly(), ValidationMode.SOFT, null);

            assertThat(result.fallback()).isFalse();
            assertThat(result.forgiveness()).isEqualTo(0.15);
            assertThat(result.adjustedScore()).isEqualTo(85);
        }

        @Test
        @DisplayName("分析本身出錯時回傳安全預設值，不拋出例外")
        void internalErrorReturnsSafeDefault() {
            StudySession broken = mock(StudySession.class);
            when(broken.getDurationMinutes()).thenThrow(new IllegalStateException("boom"));

            AuditResult result = service.evaluate(user(0, 0), broken, heartbeatsOnly(), ValidationMode.STRICT, null);

            assertThat(result.fallback()).isTrue();
            assertThat(result.valid()).isTrue();
            assertThat(result.adjustedScore()).isZero();
            assertThat(result.mode()).isEqualTo(ValidationMode.STRICT);
        }
    }

    @Nested
    @DisplayName("稽核紀錄")
    class Record {

        @Test
        @DisplayName("寫入分數、模式與異常 JSON")
        void writesAuditRow() {
            when(gateway.fetchRecentAuditScores(eq(USER_ID), any())).thenReturn(List.of());
            AuditResult result = service.evaluate(user(0, 0), session, heartbeatsOnly(), ValidationMode.SOFT, null);

            service.record(USER_ID, SESSION_ID, result);

            ArgumentCaptor<SessionAudit> captor = ArgumentCaptor.forClass(SessionAudit.class);
            verify(gateway).appendAuditRecord(captor.capture());
            SessionAudit row = captor.getValue();
            assertThat(row.getSessionId()).isEqualTo(SESSION_ID);
            assertThat(row.getSuspicionScore()).isEqualTo(100);
            assertThat(row.isFlagged()).isTrue();
            assertThat(row.getValidationMode()).isEqualTo(ValidationMode.SOFT);
            assertThat(row.getReasons()).startsWith("[").contains("MISSING_START");
            assertThat(row.getCreatedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("安全預設值不寫入")
        void skipsFallback() {
            service.record(USER_ID, SESSION_ID, AuditResult.safeDefault(ValidationMode.SOFT));

            verify(gateway, never()).appendAuditRecord(any());
        }
    }

    @Test
    @DisplayName("查詢寬恕明細：使用者不存在時拋出 NoSuchElementException")
    void forgivenessProfile() {
        UUID unknown = UUID.randomUUID();
        when(gateway.fetchUserStats(unknown)).thenReturn(Optional.empty());
        when(gateway.fetchUserStats(USER_ID)).thenReturn(Optional.of(user(2, 1000)));
        when(gateway.fetchRecentAuditScores(eq(USER_ID), eq(NOW.minus(Duration.ofDays(30))))).thenReturn(List.of());

        ForgivenessProfile profile = service.getForgivenessProfile(USER_ID);

        assertThat(profile.streakComponent()).isEqualTo(0.25);
        assertThat(profile.xpComponent()).isEqualTo(0.08);
        assertThatThrownBy(() -> service.getForgivenessProfile(unknown)).isInstanceOf(NoSuchElementException.class);
    }
}

package com.aiinpocket.studyquest.gateway;

import com.aiinpocket.studyquest.config.ResilienceConfig;
import com.aiinpocket.studyquest.model.dto.UserStatsPatch;
import com.aiinpocket.studyquest.model.entity.StudySession;
import com.aiinpocket.studyquest.support.TestGamificationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetryingEventStoreGateway")
class RetryingEventStoreGatewayTest {

    private static final UUID SESSION_ID = UUID.fromString("00000000-0000-0000-0000-00000000c0de");

    @Mock
    private EventStoreGateway delegate;

    private RetryingEventStoreGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new RetryingEventStoreGateway(delegate,
                new ResilienceConfig().retryRegistry(TestGamificationProperties.withRetry(3, 1)));
    }

    @Test
    @DisplayName("暫時性錯誤重試後成功")
    void retriesTransientFailures() {
        StudySession session = StudySession.builder().id(SESSION_ID).createdAt(Instant.EPOCH).build();
        when(delegate.fetchSession(SESSION_ID))
                .thenThrow(new QueryTimeoutException("slow"))
                .thenThrow(new QueryTimeoutException("slow"))
                .thenReturn(Optional.of(session));

        assertThat(gateway.fetchSession(SESSION_ID)).contains(session);
        verify(delegate, times(3)).fetchSession(SESSION_ID);
    }

    @Test
    @DisplayName("重試用盡後轉成 GatewayException")
    void wrapsAfterExhaustion() {
        when(delegate.fetchSession(SESSION_ID)).thenThrow(new QueryTimeoutException("slow"));

        assertThatThrownBy(() -> gateway.fetchSession(SESSION_ID))
                .isInstanceOf(GatewayException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class)
                .satisfies(e -> assertThat(((GatewayException) e).getOperation()).isEqualTo("fetchSession"));
        verify(delegate, times(3)).fetchSession(SESSION_ID);
    }

    @Test
    @DisplayName("違反唯一約束不重試")
    void integrityViolationIsNotRetried() {
        when(delegate.claimProcessing(any(), any(), anyInt()))
                .thenThrow(new DataIntegrityViolationException("duplicate key"));

        assertThatThrownBy(() -> gateway.claimProcessing(UUID.randomUUID(), SESSION_ID, 1))
                .isInstanceOf(GatewayException.class);
        verify(delegate, times(1)).claimProcessing(any(), any(), anyInt());
    }

    @Test
    @DisplayName("非資料存取錯誤原樣拋出")
    void otherExceptionsPropagate() {
        when(delegate.countSessions(any())).thenThrow(new IllegalArgumentException("bad id"));

        assertThatThrownBy(() -> gateway.countSessions(UUID.randomUUID()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("bad id");
        verify(delegate, times(1)).countSessions(any());
    }

    @Test
    @DisplayName("沒有回傳值的寫入同樣重試")
    void retriesVoidWrites() {
        UUID userId = UUID.randomUUID();
        UserStatsPatch patch = UserStatsPatch.streak(3, 5, Instant.EPOCH);
        doThrow(new QueryTimeoutException("slow")).doNothing().when(delegate).updateUserStats(userId, patch);

        gateway.updateUserStats(userId, patch);

        verify(delegate, times(2)).updateUserStats(userId, patch);
    }
}

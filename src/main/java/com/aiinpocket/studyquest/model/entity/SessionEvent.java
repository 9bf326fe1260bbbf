package com.aiinpocket.studyquest.model.entity;

import com.aiinpocket.studyquest.model.enums.SessionEventType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Session 遙測事件。寫入後不可變，依 created_at 排序。
 * payload 以原始 JSON 字串保存，結構驗證交由稽核分析器處理。
 */
@Entity
@Immutable
@Table(name = "session_event", indexes = {
        @Index(name = "idx_event_session_created", columnList = "session_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 20)
    private SessionEventType eventType;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}

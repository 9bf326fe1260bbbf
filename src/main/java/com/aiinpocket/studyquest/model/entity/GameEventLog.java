package com.aiinpocket.studyquest.model.entity;

import com.aiinpocket.studyquest.model.enums.GameEventType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 已派送給前端的遊戲化事件（待看事件列表）。
 */
@Entity
@Table(name = "game_event_log", indexes = {
        @Index(name = "idx_event_user_seen", columnList = "user_id, seen")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameEventLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 30)
    private GameEventType eventType;

    @Column(name = "event_data", length = 500)
    private String eventData;

    @Column(nullable = false)
    @Builder.Default
    private boolean seen = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}

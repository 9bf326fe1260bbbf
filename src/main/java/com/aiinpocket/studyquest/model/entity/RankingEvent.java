package com.aiinpocket.studyquest.model.entity;

import com.aiinpocket.studyquest.model.enums.RankingEventType;
import com.aiinpocket.studyquest.model.enums.Tier;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 段位變動紀錄（只增不改）。
 */
@Entity
@Table(name = "ranking_event", indexes = {
        @Index(name = "idx_ranking_user_created", columnList = "user_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RankingEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 20)
    private RankingEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_tier", nullable = false, length = 20)
    private Tier fromTier;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_tier", nullable = false, length = 20)
    private Tier toTier;

    @Column(length = 200)
    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}

package com.aiinpocket.studyquest.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * 每位使用者每日（錨定時區的日曆日）的讀書統計。
 * dailyGoalSessionId 記錄當天拿到每日目標獎勵的 session，保證同一天最多發一次。
 */
@Entity
@Table(name = "daily_user_metrics", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"user_id", "metric_date"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyUserMetrics {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "metric_date", nullable = false)
    private LocalDate metricDate;

    @Column(name = "total_minutes", nullable = false)
    @Builder.Default
    private int totalMinutes = 0;

    @Column(name = "xp_earned", nullable = false)
    @Builder.Default
    private int xpEarned = 0;

    @Column(name = "daily_goal_session_id")
    private UUID dailyGoalSessionId;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        this.updatedAt = Instant.now();
    }
}

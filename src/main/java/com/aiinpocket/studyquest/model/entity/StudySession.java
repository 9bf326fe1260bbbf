package com.aiinpocket.studyquest.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * 讀書 session（由計時模組建立，本服務唯讀）。
 */
@Entity
@Immutable
@Table(name = "study_session", indexes = {
        @Index(name = "idx_session_user_created", columnList = "user_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudySession {

    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    /** 專注效率 0~100，可為空 */
    private Integer efficiency;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}

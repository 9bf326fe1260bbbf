package com.aiinpocket.studyquest.model.entity;

import com.aiinpocket.studyquest.model.enums.PipelineStage;
import com.aiinpocket.studyquest.model.enums.ProcessingStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 結算冪等鍵。
 * (user_id, session_id, pipeline_version) 唯一約束確保同一 session 同一版本流程最多只結算一次，
 * 跨 Pod 的重試也會在插入時被擋下。
 */
@Entity
@Table(name = "session_processing", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"user_id", "session_id", "pipeline_version"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionProcessing {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "pipeline_version", nullable = false)
    private int pipelineVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ProcessingStatus status = ProcessingStatus.IN_PROGRESS;

    /** 最後一個完整提交的階段 */
    @Enumerated(EnumType.STRING)
    @Column(name = "last_completed_stage", length = 20)
    private PipelineStage lastCompletedStage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}

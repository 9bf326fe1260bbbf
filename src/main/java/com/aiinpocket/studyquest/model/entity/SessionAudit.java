package com.aiinpocket.studyquest.model.entity;

import com.aiinpocket.studyquest.model.enums.RiskLevel;
import com.aiinpocket.studyquest.model.enums.ValidationMode;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Session 稽核紀錄。每個 (session, 驗證模式) 只會有一筆，重算前必須先刪除舊紀錄。
 */
@Entity
@Table(name = "session_audit", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"session_id", "validation_mode"})
}, indexes = {
        @Index(name = "idx_audit_user_created", columnList = "user_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionAudit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private UUID sessionId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    /** 套用寬恕前的懷疑分數 */
    @Column(name = "base_suspicion_score", nullable = false)
    private int baseSuspicionScore;

    /** 套用寬恕後的懷疑分數 0~100 */
    @Column(name = "suspicion_score", nullable = false)
    private int suspicionScore;

    /** 偵測到的異常描述 JSON 陣列 */
    @Column(columnDefinition = "TEXT")
    private String reasons;

    @Column(name = "is_flagged", nullable = false)
    private boolean flagged;

    @Column(name = "forgiveness_applied", nullable = false)
    private double forgivenessApplied;

    @Enumerated(EnumType.STRING)
    @Column(name = "validation_mode", nullable = false, length = 10)
    private ValidationMode validationMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", nullable = false, length = 10)
    private RiskLevel riskLevel;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}

package com.aiinpocket.studyquest.model.entity;

import com.aiinpocket.studyquest.model.enums.XpSource;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * XP 帳本（只增不改）。使用者的 totalXp 即為此表 amount 的總和。
 */
@Entity
@Table(name = "xp_history", indexes = {
        @Index(name = "idx_xp_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_xp_session", columnList = "session_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class XpHistoryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    /** 來源 session（重算時據此刪除），非 session 來源可為空 */
    @Column(name = "session_id")
    private UUID sessionId;

    @Column(nullable = false)
    private int amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private XpSource source;

    /** 計算明細 JSON */
    @Column(columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}

package com.aiinpocket.studyquest.model.entity;

import com.aiinpocket.studyquest.model.enums.Tier;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 使用者遊戲化狀態 Entity。
 * 使用者帳號本身由認證模組建立，本服務只維護遊戲化欄位。
 * 等級不落地儲存，永遠由 totalXp 推導（見 LevelCalculator）。
 */
@Entity
@Table(name = "app_user", indexes = {
        @Index(name = "idx_user_tier", columnList = "tier"),
        @Index(name = "idx_user_total_xp", columnList = "total_xp")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AppUser {

    @Id
    private UUID id;

    /** 顯示名稱（來自認證模組） */
    @Column(name = "display_name", length = 100)
    private String displayName;

    // ===== 遊戲化欄位 =====

    /** 累計經驗值（= XP 帳本總和） */
    @Column(name = "total_xp", nullable = false)
    @Builder.Default
    private Long totalXp = 0L;

    /** 目前連續讀書天數 */
    @Column(name = "current_streak", nullable = false)
    @Builder.Default
    private Integer currentStreak = 0;

    /** 歷史最佳連續天數 */
    @Column(name = "best_streak", nullable = false)
    @Builder.Default
    private Integer bestStreak = 0;

    /** 目前段位 */
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private Tier tier = Tier.BRONZE;

    @Column(name = "promotion_count", nullable = false)
    @Builder.Default
    private Integer promotionCount = 0;

    @Column(name = "downgrade_count", nullable = false)
    @Builder.Default
    private Integer downgradeCount = 0;

    /** 最後一次讀書結算時間（用於閒置降級判定） */
    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}

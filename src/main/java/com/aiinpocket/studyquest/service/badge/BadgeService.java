package com.aiinpocket.studyquest.service.badge;

import com.aiinpocket.studyquest.gateway.EventStoreGateway;
import com.aiinpocket.studyquest.model.dto.UserGameState;
import com.aiinpocket.studyquest.model.enums.BadgeDef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 徽章解鎖檢查。每個徽章每位使用者最多解鎖一次（唯一約束保證）。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BadgeService {

    private final EventStoreGateway gateway;

    /**
     * 依結算後的狀態檢查所有徽章。
     *
     * @param user          結算後的使用者狀態
     * @param todayMinutes  當日累計讀書分鐘數（含這次）
     * @param sessionCount  累計 session 數
     * @return 這次新解鎖的徽章
     */
    public List<BadgeDef> checkAndUnlock(UserGameState user, int todayMinutes, long sessionCount) {
        // 批次查詢已解鎖徽章（一次查詢取代逐一 exists）
        Set<String> alreadyUnlocked = gateway.fetchUnlockedBadges(user.userId());

        List<BadgeDef> unlocked = new ArrayList<>();
        for (BadgeDef def : BadgeDef.values()) {
            long value = switch (def.getRequirement()) {
                case SESSION_COUNT -> sessionCount;
                case STREAK_DAYS -> user.currentStreak();
                case DAILY_MINUTES -> todayMinutes;
                case LEVEL -> user.level();
                case TOTAL_XP -> user.totalXp();
            };
            unlocked.addAll(tryUnlock(user, def, value >= def.getRequiredValue(), alreadyUnlocked));
        }
        return unlocked;
    }

    // ===== 內部方法 =====

    private List<BadgeDef> tryUnlock(UserGameState user, BadgeDef def, boolean condition, Set<String> alreadyUnlocked) {
        if (!condition) return List.of();
        if (alreadyUnlocked.contains(def.name())) return List.of();
        if (!gateway.unlockBadge(user.userId(), def.name())) return List.of();

        log.info("[徽章] 用戶 {} 解鎖徽章: {} ({})", user.userId(), def.name(), def.getDisplayName());
        return List.of(def);
    }
}

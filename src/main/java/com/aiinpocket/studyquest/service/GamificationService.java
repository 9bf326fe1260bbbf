package com.aiinpocket.studyquest.service;

import com.aiinpocket.studyquest.model.dto.GameEvent;
import com.aiinpocket.studyquest.model.dto.GamificationProfile;
import com.aiinpocket.studyquest.model.dto.GamificationProfile.PendingEvent;
import com.aiinpocket.studyquest.model.dto.GamificationProfile.UnlockedBadge;
import com.aiinpocket.studyquest.model.dto.StreakResult;
import com.aiinpocket.studyquest.model.entity.AppUser;
import com.aiinpocket.studyquest.model.entity.GameEventLog;
import com.aiinpocket.studyquest.model.enums.BadgeDef;
import com.aiinpocket.studyquest.repository.AppUserRepository;
import com.aiinpocket.studyquest.repository.GameEventLogRepository;
import com.aiinpocket.studyquest.repository.UserBadgeRepository;
import com.aiinpocket.studyquest.service.streak.StreakService;
import com.aiinpocket.studyquest.service.xp.XpCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.UUID;

/**
 * 遊戲化個人檔案與待看事件。
 * 結算流程回傳的領域事件由呼叫端透過 {@link #dispatch} 寫入 game_event_log，前端再以待看事件列表取得。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GamificationService {

    /** event_data 欄位長度上限 */
    private static final int EVENT_DATA_MAX = 500;

    private final AppUserRepository userRepo;
    private final UserBadgeRepository badgeRepo;
    private final GameEventLogRepository eventRepo;
    private final XpCalculator xpCalculator;
    private final StreakService streakService;
    private final ObjectMapper objectMapper;

    /**
     * 將領域事件寫入待看事件表。
     */
    @Transactional
    public int dispatch(List<GameEvent> events) {
        for (GameEvent event : events) {
            String data = objectMapper.writeValueAsString(event.data());
            if (data.length() > EVENT_DATA_MAX) {
                data = data.substring(0, EVENT_DATA_MAX);
            }
            eventRepo.save(GameEventLog.builder()
                    .userId(event.userId())
                    .eventType(event.type())
                    .eventData(data)
                    .build());
        }
        if (!events.isEmpty()) {
            log.debug("[遊戲化] 已派送 {} 筆事件", events.size());
        }
        return events.size();
    }

    /**
     * 取得用戶遊戲化個人檔案。
     */
    @Transactional(readOnly = true)
    public GamificationProfile getProfile(UUID userId) {
        AppUser user = userRepo.findById(userId).orElseThrow();
        StreakResult streak = streakService.getCurrentStreak(userId);

        List<UnlockedBadge> badges = badgeRepo.findByUserIdOrderByUnlockedAtDesc(userId)
                .stream()
                .map(b -> {
                    BadgeDef def;
                    try {
                        def = BadgeDef.valueOf(b.getBadgeKey());
                    } catch (IllegalArgumentException e) {
                        return new UnlockedBadge(b.getBadgeKey(), b.getBadgeKey(), "", b.getUnlockedAt().toString());
                    }
                    return new UnlockedBadge(b.getBadgeKey(), def.getDisplayName(), def.getDescription(),
                            b.getUnlockedAt().toString());
                })
                .toList();

        return new GamificationProfile(
                xpCalculator.levelProgress(user.getTotalXp()),
                streak.currentStreak(),
                streak.bestStreak(),
                streak.multiplier(),
                user.getTier(),
                badges,
                getPendingEvents(userId)
        );
    }

    @Transactional(readOnly = true)
    public List<PendingEvent> getPendingEvents(UUID userId) {
        return eventRepo.findByUserIdAndSeenFalseOrderByCreatedAtDesc(userId)
                .stream()
                .map(e -> new PendingEvent(e.getId(), e.getEventType().name(), e.getEventData(),
                        e.getCreatedAt().toString()))
                .toList();
    }

    /**
     * 標記所有未看事件為已看。
     */
    @Transactional
    public int markEventsSeen(UUID userId) {
        return eventRepo.markAllSeenByUserId(userId);
    }
}

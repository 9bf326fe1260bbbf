package com.aiinpocket.studyquest.service.xp;

import com.aiinpocket.studyquest.config.GamificationProperties;
import com.aiinpocket.studyquest.gateway.EventStoreGateway;
import com.aiinpocket.studyquest.model.dto.LevelProgress;
import com.aiinpocket.studyquest.model.dto.UserGameState;
import com.aiinpocket.studyquest.model.dto.XpBreakdown;
import com.aiinpocket.studyquest.model.dto.XpCommitResult;
import com.aiinpocket.studyquest.model.entity.DailyUserMetrics;
import com.aiinpocket.studyquest.model.entity.StudySession;
import com.aiinpocket.studyquest.model.entity.XpHistoryEntry;
import com.aiinpocket.studyquest.model.enums.XpMilestone;
import com.aiinpocket.studyquest.model.enums.XpSource;
import com.aiinpocket.studyquest.service.streak.StreakCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Session XP 發放：讀取當日統計、計算明細、寫入帳本。
 * 帳本、使用者 totalXp 與當日統計在同一個交易內提交，不會出現只有帳本沒有累計值的狀態。
 */
@Service
@Slf4j
public class XpService {

    private final XpCalculator calculator;
    private final EventStoreGateway gateway;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ZoneOffset anchorOffset;

    public XpService(XpCalculator calculator, EventStoreGateway gateway, ObjectMapper objectMapper,
                     Clock clock, GamificationProperties properties) {
        this.calculator = calculator;
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.anchorOffset = properties.streak().zoneOffset();
    }

    /**
     * 計算 session 的 XP 明細（不寫入）。
     */
    public XpBreakdown calculate(UserGameState user, StudySession session, double multiplier) {
        LocalDate day = StreakCalculator.anchorDate(session.getCreatedAt(), anchorOffset);
        Optional<DailyUserMetrics> today = gateway.fetchDailyMetrics(user.userId(), day);
        int minutesBefore = today.map(DailyUserMetrics::getTotalMinutes).orElse(0);
        boolean goalAwarded = today.map(m -> m.getDailyGoalSessionId() != null).orElse(false);

        return calculator.calculate(session.getDurationMinutes(), user.totalXp(), minutesBefore,
                multiplier, goalAwarded);
    }

    /**
     * 寫入 XP 帳本：session 本身（base + 番茄鐘）、每日目標、各里程碑各一筆。
     */
    public XpCommitResult commit(UUID userId, StudySession session, XpBreakdown breakdown) {
        LocalDate day = StreakCalculator.anchorDate(session.getCreatedAt(), anchorOffset);
        List<XpHistoryEntry> entries = new ArrayList<>();

        Map<String, Object> sessionMeta = new LinkedHashMap<>();
        sessionMeta.put("durationMinutes", session.getDurationMinutes());
        sessionMeta.put("base", breakdown.base());
        sessionMeta.put("bonusPomodoro", breakdown.bonusPomodoro());
        sessionMeta.put("multiplier", breakdown.multiplier());
        entries.add(entry(userId, session.getId(), breakdown.base() + breakdown.bonusPomodoro(),
                XpSource.SESSION, sessionMeta));

        if (breakdown.bonusDailyGoal() > 0) {
            entries.add(entry(userId, session.getId(), breakdown.bonusDailyGoal(), XpSource.DAILY_BONUS,
                    Map.of("date", day.toString())));
        }
        if (breakdown.milestone500() > 0) {
            entries.add(entry(userId, session.getId(), breakdown.milestone500(), XpSource.MILESTONE,
                    Map.of("milestone", XpMilestone.XP_500.getThreshold())));
        }
        if (breakdown.milestone10000() > 0) {
            entries.add(entry(userId, session.getId(), breakdown.milestone10000(), XpSource.MILESTONE,
                    Map.of("milestone", XpMilestone.XP_10000.getThreshold())));
        }

        UUID goalSession = breakdown.bonusDailyGoal() > 0 ? session.getId() : null;
        XpCommitResult result = gateway.commitXpAward(userId, entries, day, session.getDurationMinutes(), goalSession);

        log.info("[經驗值] 用戶 {} 獲得 {} XP (session {}): {} → {}",
                userId, breakdown.total(), session.getId(), result.previousTotal(), result.newTotal());
        if (breakdown.leveledUp()) {
            log.info("[經驗值] 用戶 {} 升級: Lv.{} → Lv.{}", userId, breakdown.previousLevel(), breakdown.newLevel());
        }
        return result;
    }

    /**
     * 取得使用者的等級進度。
     */
    public LevelProgress getLevelProgress(UUID userId) {
        UserGameState user = gateway.fetchUserStats(userId)
                .orElseThrow(() -> new NoSuchElementException("使用者不存在: " + userId));
        return calculator.levelProgress(user.totalXp());
    }

    // ===== 內部方法 =====

    private XpHistoryEntry entry(UUID userId, UUID sessionId, int amount, XpSource source, Map<String, Object> meta) {
        return XpHistoryEntry.builder()
                .userId(userId)
                .sessionId(sessionId)
                .amount(amount)
                .source(source)
                .metadata(objectMapper.writeValueAsString(meta))
                .createdAt(clock.instant())
                .build();
    }
}

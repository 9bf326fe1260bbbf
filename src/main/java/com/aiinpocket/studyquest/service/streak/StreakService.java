package com.aiinpocket.studyquest.service.streak;

import com.aiinpocket.studyquest.gateway.EventStoreGateway;
import com.aiinpocket.studyquest.model.dto.StreakResult;
import com.aiinpocket.studyquest.model.dto.UserGameState;
import com.aiinpocket.studyquest.model.dto.UserStatsPatch;
import com.aiinpocket.studyquest.model.dto.XpCommitResult;
import com.aiinpocket.studyquest.model.entity.StudySession;
import com.aiinpocket.studyquest.model.entity.XpHistoryEntry;
import com.aiinpocket.studyquest.model.enums.XpMilestone;
import com.aiinpocket.studyquest.model.enums.XpSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * 連續天數服務：讀取 session 歷史、計算、寫回使用者狀態與連續天數獎勵。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StreakService {

    private final StreakCalculator calculator;
    private final EventStoreGateway gateway;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * 結算前的連續天數（不含這次 session，以 session 時間為判定點），用於 XP 倍率。
     */
    public PreSessionStreak beforeSession(UUID userId, StudySession session) {
        List<Instant> history = new ArrayList<>(gateway.fetchSessionTimestamps(userId, session.getCreatedAt()));
        history.remove(session.getCreatedAt());

        LocalDate sessionDay = calculator.anchorDate(session.getCreatedAt());
        boolean firstOfDay = history.stream().noneMatch(t -> calculator.anchorDate(t).equals(sessionDay));

        StreakResult streak = calculator.calculate(history, session.getCreatedAt(), 0);
        return new PreSessionStreak(streak, firstOfDay);
    }

    /**
     * 結算後的連續天數（含這次 session，以現在時間為判定點）。
     */
    public StreakResult afterSession(UserGameState user) {
        Instant now = clock.instant();
        List<Instant> history = gateway.fetchSessionTimestamps(user.userId(), now);
        return calculator.calculate(history, now, user.bestStreak());
    }

    /**
     * 寫回連續天數與最後活動時間（最後活動時間只往後推）。
     */
    public void persist(UserGameState user, StudySession session, StreakResult result) {
        Instant activity = session.getCreatedAt();
        if (user.lastActivityAt() != null && user.lastActivityAt().isAfter(activity)) {
            activity = user.lastActivityAt();
        }
        gateway.updateUserStats(user.userId(),
                UserStatsPatch.streak(result.currentStreak(), result.bestStreak(), activity));
        log.info("[連續天數] 用戶 {} 連續 {} 天 (最佳 {}), 倍率 {}",
                user.userId(), result.currentStreak(), result.bestStreak(), result.multiplier());
    }

    /**
     * 當天第一次讀書時發放連續天數獎勵。
     * 獎勵可能讓累計 XP 跨過里程碑，里程碑獎勵與連續天數獎勵在同一次提交內寫入。
     *
     * @param currentTotal 發放前的累計 XP（session XP 已入帳）
     */
    public StreakBonus awardBonus(UUID userId, StudySession session, StreakResult result, long currentTotal) {
        if (result.bonusXp() <= 0) {
            return StreakBonus.NONE;
        }
        List<XpHistoryEntry> entries = new ArrayList<>();
        entries.add(entry(userId, session, result.bonusXp(), XpSource.STREAK,
                Map.of("streak", result.currentStreak())));

        List<XpMilestone> milestones = new ArrayList<>();
        for (XpMilestone milestone : XpMilestone.values()) {
            if (milestone.crossedBy(currentTotal, currentTotal + result.bonusXp())) {
                milestones.add(milestone);
                entries.add(entry(userId, session, milestone.getReward(), XpSource.MILESTONE,
                        Map.of("milestone", milestone.getThreshold())));
            }
        }

        XpCommitResult commit = gateway.commitXpAward(userId, entries, calculator.anchorDate(session.getCreatedAt()),
                0, null);
        log.info("[連續天數] 用戶 {} 獲得連續 {} 天獎勵 {} XP, 里程碑 {}",
                userId, result.currentStreak(), result.bonusXp(), milestones);
        return new StreakBonus(result.bonusXp(), List.copyOf(milestones), commit.newTotal());
    }

    /**
     * 以現在時間重新判定使用者的連續天數（個人檔案顯示用，不寫入）。
     */
    public StreakResult getCurrentStreak(UUID userId) {
        UserGameState user = gateway.fetchUserStats(userId)
                .orElseThrow(() -> new NoSuchElementException("使用者不存在: " + userId));
        StreakResult result = afterSession(user);
        return new StreakResult(result.currentStreak(), result.bestStreak(), result.multiplier(),
                result.bonusXp(), null);
    }

    // ===== 內部方法 =====

    private XpHistoryEntry entry(UUID userId, StudySession session, int amount, XpSource source,
                                 Map<String, Object> meta) {
        return XpHistoryEntry.builder()
                .userId(userId)
                .sessionId(session.getId())
                .amount(amount)
                .source(source)
                .metadata(objectMapper.writeValueAsString(meta))
                .createdAt(clock.instant())
                .build();
    }

    public record PreSessionStreak(StreakResult streak, boolean firstSessionOfDay) {}

    /**
     * 連續天數獎勵的發放結果。newTotal 為提交後的累計 XP，未發放時為 -1。
     */
    public record StreakBonus(int bonusXp, List<XpMilestone> milestones, long newTotal) {

        public static final StreakBonus NONE = new StreakBonus(0, List.of(), -1);

        public int milestoneXp() {
            return milestones.stream().mapToInt(XpMilestone::getReward).sum();
        }

        public boolean awarded() {
            return bonusXp > 0;
        }
    }
}

package com.aiinpocket.studyquest.service.streak;

import com.aiinpocket.studyquest.config.GamificationProperties;
import com.aiinpocket.studyquest.model.dto.StreakResult;
import com.aiinpocket.studyquest.model.enums.StreakMilestone;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.Collections;
import java.util.TreeSet;

/**
 * 連續天數計算器（純計算）。
 *
 * <p>所有 session 時間先換算到固定的錨定時區（預設 +05:30）取日曆日：
 * <ul>
 *   <li>best：最長的連續日曆日區段</li>
 *   <li>current：距離最近一次 session 超過 36 小時即歸零（剛好 36 小時仍保留），
 *       否則從最近一次 session 的日期往回數連續有讀書的天數</li>
 * </ul>
 */
@Component
public class StreakCalculator {

    static final int MAX_BONUS_XP = 50;

    private final ZoneOffset anchorOffset;
    private final Duration continuityWindow;

    public StreakCalculator(GamificationProperties properties) {
        this.anchorOffset = properties.streak().zoneOffset();
        this.continuityWindow = Duration.ofHours(properties.streak().continuityHours());
    }

    public static LocalDate anchorDate(Instant instant, ZoneOffset offset) {
        return LocalDate.ofInstant(instant, offset);
    }

    public LocalDate anchorDate(Instant instant) {
        return anchorDate(instant, anchorOffset);
    }

    /** 倍率 = min(1.0 + 0.1 × 天數, 2.0)，以整數運算避免浮點誤差 */
    public static double multiplierFor(int streak) {
        return Math.min(10 + Math.max(streak, 0), 20) / 10.0;
    }

    /** 每滿 7 天 +2 XP，上限 50 */
    public static int bonusFor(int streak) {
        return Math.min((Math.max(streak, 0) / 7) * 2, MAX_BONUS_XP);
    }

    /**
     * @param sessionTimes 使用者的 session 時間（順序不拘）
     * @param now          判定時間點
     * @param previousBest 先前記錄的最佳連續天數（用於判斷里程碑是否首次達成）
     */
    public StreakResult calculate(Collection<Instant> sessionTimes, Instant now, int previousBest) {
        if (sessionTimes == null || sessionTimes.isEmpty()) {
            return new StreakResult(0, Math.max(previousBest, 0), multiplierFor(0), 0, null);
        }

        TreeSet<LocalDate> days = new TreeSet<>();
        for (Instant t : sessionTimes) {
            days.add(anchorDate(t));
        }
        Instant latest = Collections.max(sessionTimes);

        int longest = longestRun(days);
        int current = 0;
        if (Duration.between(latest, now).compareTo(continuityWindow) <= 0) {
            LocalDate cursor = anchorDate(latest);
            while (days.contains(cursor)) {
                current++;
                cursor = cursor.minusDays(1);
            }
        }

        int best = Math.max(Math.max(longest, previousBest), current);
        StreakMilestone milestone = StreakMilestone.firstReached(previousBest, current).orElse(null);
        return new StreakResult(current, best, multiplierFor(current), bonusFor(current), milestone);
    }

    private static int longestRun(TreeSet<LocalDate> days) {
        int longest = 0;
        int run = 0;
        LocalDate previous = null;
        for (LocalDate day : days) {
            run = previous != null && previous.plusDays(1).equals(day) ? run + 1 : 1;
            longest = Math.max(longest, run);
            previous = day;
        }
        return longest;
    }
}

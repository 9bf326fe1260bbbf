package com.aiinpocket.studyquest.service.xp;

import com.aiinpocket.studyquest.config.GamificationProperties;
import com.aiinpocket.studyquest.model.dto.LevelProgress;
import com.aiinpocket.studyquest.model.dto.XpBreakdown;
import com.aiinpocket.studyquest.model.enums.XpMilestone;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * XP 計算器（純計算）。
 *
 * <ul>
 *   <li>base = floor(時長 × 每分鐘 XP × 連續天數倍率)</li>
 *   <li>番茄鐘獎勵：時長 ≥ 25 分鐘</li>
 *   <li>每日目標獎勵：當日累計分鐘數在這次結算跨過 120 分鐘，且當天尚未發過</li>
 *   <li>里程碑：以 base + 兩項獎勵後的累計值判定是否跨過 500 / 10,000</li>
 * </ul>
 * 等級永遠由累計 XP 推導：每 100 XP 一級，從 Lv.1 開始。
 */
@Component
public class XpCalculator {

    public static final int XP_PER_LEVEL = 100;

    /** 個人檔案顯示用的累計 XP 目標 */
    static final long[] PROGRESS_MILESTONES = {500, 1_000, 5_000, 10_000, 25_000, 50_000, 100_000};

    private final GamificationProperties.XpParams params;

    public XpCalculator(GamificationProperties properties) {
        this.params = properties.xp();
    }

    public static int levelFor(long totalXp) {
        return (int) (Math.max(0, totalXp) / XP_PER_LEVEL) + 1;
    }

    /**
     * 計算單一 session 的 XP。
     *
     * @param durationMinutes         session 時長（1 ~ 上限）
     * @param previousTotal           結算前累計 XP
     * @param todayMinutesBefore      結算前當日已累計的分鐘數
     * @param multiplier              連續天數倍率（1.0 ~ 2.0）
     * @param dailyGoalAlreadyAwarded 當天是否已發過每日目標獎勵
     */
    public XpBreakdown calculate(int durationMinutes, long previousTotal, int todayMinutesBefore,
                                 double multiplier, boolean dailyGoalAlreadyAwarded) {
        if (durationMinutes <= 0 || durationMinutes > params.maxSessionMinutes()) {
            throw new IllegalArgumentException("無效的讀書時長: " + durationMinutes + " 分鐘");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("倍率不可小於 1.0: " + multiplier);
        }

        int base = BigDecimal.valueOf(durationMinutes)
                .multiply(BigDecimal.valueOf(params.ratePerMinute()))
                .multiply(BigDecimal.valueOf(multiplier))
                .setScale(0, RoundingMode.FLOOR)
                .intValueExact();

        int pomodoro = durationMinutes >= params.pomodoroMinutes() ? params.pomodoroBonus() : 0;

        int goal = params.dailyGoalMinutes();
        boolean crossesGoal = todayMinutesBefore < goal && todayMinutesBefore + durationMinutes >= goal;
        int dailyGoal = crossesGoal && !dailyGoalAlreadyAwarded ? params.dailyGoalBonus() : 0;

        long beforeMilestones = previousTotal + base + pomodoro + dailyGoal;
        int m500 = XpMilestone.XP_500.crossedBy(previousTotal, beforeMilestones) ? XpMilestone.XP_500.getReward() : 0;
        int m10000 = XpMilestone.XP_10000.crossedBy(previousTotal, beforeMilestones) ? XpMilestone.XP_10000.getReward() : 0;

        int total = base + pomodoro + dailyGoal + m500 + m10000;
        long newTotal = previousTotal + total;
        return new XpBreakdown(base, pomodoro, dailyGoal, m500, m10000, total, multiplier,
                previousTotal, newTotal, levelFor(previousTotal), levelFor(newTotal));
    }

    /**
     * 等級進度與下一個 XP 里程碑。
     */
    public LevelProgress levelProgress(long totalXp) {
        int level = levelFor(totalXp);
        long levelStart = (long) (level - 1) * XP_PER_LEVEL;
        long into = totalXp - levelStart;
        long toNext = levelStart + XP_PER_LEVEL - totalXp;
        double pct = Math.round(into * 1000.0 / XP_PER_LEVEL) / 10.0;

        Long next = null;
        for (long m : PROGRESS_MILESTONES) {
            if (totalXp < m) {
                next = m;
                break;
            }
        }
        return new LevelProgress(totalXp, level, into, toNext, pct, next, next != null ? next - totalXp : null);
    }
}

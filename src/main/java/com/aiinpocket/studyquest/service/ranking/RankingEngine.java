package com.aiinpocket.studyquest.service.ranking;

import com.aiinpocket.studyquest.model.enums.StreakMilestone;
import com.aiinpocket.studyquest.model.enums.Tier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 段位狀態機（純計算）。
 *
 * <ul>
 *   <li>段位判定：同時滿足 minXp 與 minStreak 的最高段位</li>
 *   <li>晉升：目前段位的 promotionXp 與 promotionStreak 必須同時達成（AND），一次往上一階，可連續多階</li>
 *   <li>降級：閒置天數嚴格大於段位門檻時，以目前 (xp, streak) 重新判定，較低才降級</li>
 *   <li>綜合分數：0.7 × XP 正規化 + 0.3 × 連續天數正規化（以 DIAMOND 進入門檻為基準），只用於排行榜排序</li>
 * </ul>
 */
@Component
public class RankingEngine {

    static final double XP_WEIGHT = 0.7;
    static final double STREAK_WEIGHT = 0.3;

    public Tier determineTier(long xp, int streak) {
        Tier result = Tier.BRONZE;
        for (Tier tier : Tier.values()) {
            if (tier.admits(xp, streak)) {
                result = tier;
            }
        }
        return result;
    }

    /**
     * 從目前段位開始，依序列出這次可晉升到的每一階。不符合條件時回傳空清單。
     */
    public List<Tier> promotionPath(Tier current, long xp, int streak) {
        List<Tier> path = new ArrayList<>();
        Tier tier = current;
        while (!tier.isTop() && xp >= tier.getPromotionXp() && streak >= tier.getPromotionStreak()) {
            tier = tier.next().orElseThrow();
            path.add(tier);
        }
        return path;
    }

    /**
     * 閒置降級判定。重複呼叫會得到相同結果：降級後的段位就是純函數判定值，不會再往下降。
     *
     * @return 應降到的段位；不需降級時為空
     */
    public Optional<Tier> downgradeTarget(Tier current, long xp, int streak, long inactiveDays) {
        if (!current.canDowngrade() || inactiveDays <= current.getInactivityDays()) {
            return Optional.empty();
        }
        Tier pure = determineTier(xp, streak);
        return current.isHigherThan(pure) ? Optional.of(pure) : Optional.empty();
    }

    public double compositeScore(long xp, int streak) {
        double xpPart = Math.min((double) xp / Tier.DIAMOND.getMinXp(), 1.0);
        double streakPart = Math.min((double) streak / Tier.DIAMOND.getMinStreak(), 1.0);
        return round4(XP_WEIGHT * xpPart + STREAK_WEIGHT * streakPart);
    }

    /**
     * 往下一階的進度百分比（0~100）。DIAMOND 固定為 100。
     */
    public double progressToNext(Tier current, long xp, int streak) {
        if (current.isTop()) {
            return 100.0;
        }
        double xpPart = Math.min((double) xp / current.getPromotionXp(), 1.0);
        double streakPart = Math.min((double) streak / current.getPromotionStreak(), 1.0);
        double pct = (XP_WEIGHT * xpPart + STREAK_WEIGHT * streakPart) * 100;
        return Math.round(Math.max(0, Math.min(100, pct)) * 10) / 10.0;
    }

    /**
     * 下一步目標：下一階條件、接下來兩個連續天數里程碑、下一個整千 XP。
     */
    public List<String> nextMilestones(Tier current, long xp, int streak) {
        List<String> milestones = new ArrayList<>();
        current.next().ifPresent(next -> {
            long xpGap = Math.max(0, current.getPromotionXp() - xp);
            int streakGap = Math.max(0, current.getPromotionStreak() - streak);
            milestones.add(String.format("晉升 %s：還需 %d XP、%d 天連續讀書", next.getDisplayName(), xpGap, streakGap));
        });

        int added = 0;
        for (StreakMilestone m : StreakMilestone.values()) {
            if (m.getDays() > streak && added < 2) {
                milestones.add(String.format("連續讀書 %d 天（還差 %d 天）", m.getDays(), m.getDays() - streak));
                added++;
            }
        }

        long nextThousand = (xp / 1000 + 1) * 1000;
        milestones.add(String.format("累計 %,d XP（還差 %d XP）", nextThousand, nextThousand - xp));
        return milestones;
    }

    private static double round4(double value) {
        return Math.round(value * 10_000) / 10_000.0;
    }
}

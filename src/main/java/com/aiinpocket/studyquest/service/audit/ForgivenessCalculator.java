package com.aiinpocket.studyquest.service.audit;

import com.aiinpocket.studyquest.model.dto.ForgivenessProfile;
import com.aiinpocket.studyquest.model.enums.ForgivenessFactor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 依使用者良好歷史計算寬恕係數。
 * 連續天數、累計 XP、近期乾淨 session 比例三項各自有上限，合計再受總上限限制。
 * soft / strict 兩種驗證模式共用此計算。
 */
@Component
public class ForgivenessCalculator {

    /**
     * @param currentStreak      目前連續天數
     * @param totalXp            累計 XP
     * @param recentScores       歷史窗口內的稽核調整後分數
     * @param cleanScoreThreshold 分數低於此值視為乾淨 session
     */
    public ForgivenessProfile calculate(int currentStreak, long totalXp, List<Integer> recentScores,
                                        int cleanScoreThreshold) {
        int total = recentScores.size();
        int clean = (int) recentScores.stream().filter(s -> s < cleanScoreThreshold).count();
        double cleanRate = total == 0 ? 0 : (double) clean / total;

        double streakPart = ForgivenessFactor.STREAK.apply(currentStreak);
        double xpPart = ForgivenessFactor.XP.apply(totalXp / 1000.0);
        double historyPart = ForgivenessFactor.CLEAN_HISTORY.apply(cleanRate);
        double sum = Math.min(streakPart + xpPart + historyPart, ForgivenessFactor.TOTAL_CAP);

        return new ForgivenessProfile(streakPart, xpPart, historyPart, sum, clean, total, cleanRate);
    }
}

package com.aiinpocket.studyquest.model.enums;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * 連續天數里程碑。
 */
@Getter
public enum StreakMilestone {

    DAYS_3(3),
    DAYS_7(7),
    DAYS_14(14),
    DAYS_30(30),
    DAYS_60(60),
    DAYS_100(100),
    DAYS_365(365);

    private final int days;

    StreakMilestone(int days) {
        this.days = days;
    }

    public String key() {
        return days + "_day_streak";
    }

    /**
     * 找出這次首次達成的最高里程碑：{@code previousBest < days <= current}。
     */
    public static Optional<StreakMilestone> firstReached(int previousBest, int current) {
        return Arrays.stream(values())
                .filter(m -> previousBest < m.days && m.days <= current)
                .reduce((a, b) -> b);
    }
}

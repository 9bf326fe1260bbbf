package com.aiinpocket.studyquest.model.enums;

import lombok.Getter;

/**
 * 累計 XP 里程碑獎勵。
 * 只在 {@code prevTotal < threshold <= newTotal} 的那一次結算發放，永不追溯。
 */
@Getter
public enum XpMilestone {

    XP_500(500, 100),
    XP_10000(10_000, 1000);

    private final long threshold;
    private final int reward;

    XpMilestone(long threshold, int reward) {
        this.threshold = threshold;
        this.reward = reward;
    }

    public boolean crossedBy(long previousTotal, long newTotal) {
        return previousTotal < threshold && threshold <= newTotal;
    }
}

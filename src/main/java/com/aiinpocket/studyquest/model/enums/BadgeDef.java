package com.aiinpocket.studyquest.model.enums;

import lombok.Getter;

@Getter
public enum BadgeDef {

    // 里程碑徽章
    FIRST_SESSION("初試啼聲", "完成第一次讀書", Requirement.SESSION_COUNT, 1),
    LEVEL_5("漸入佳境", "達到 Lv.5", Requirement.LEVEL, 5),
    LEVEL_10("學海健將", "達到 Lv.10", Requirement.LEVEL, 10),

    // 連續天數徽章
    STREAK_7("七日不輟", "連續讀書 7 天", Requirement.STREAK_DAYS, 7),
    STREAK_30("月光書生", "連續讀書 30 天", Requirement.STREAK_DAYS, 30),
    STREAK_100("百日苦讀", "連續讀書 100 天", Requirement.STREAK_DAYS, 100),

    // 單日時數徽章
    TEN_HOUR_DAY("十小時衝刺", "單日讀書 10 小時", Requirement.DAILY_MINUTES, 600),

    // XP 徽章
    XP_100("新手上路", "累計 100 XP", Requirement.TOTAL_XP, 100),
    XP_1000("專業學徒", "累計 1,000 XP", Requirement.TOTAL_XP, 1000),
    XP_5000("學識大師", "累計 5,000 XP", Requirement.TOTAL_XP, 5000),

    // session 次數徽章
    SESSIONS_50("勤學不倦", "完成 50 次讀書", Requirement.SESSION_COUNT, 50),
    SESSIONS_100("讀書戰士", "完成 100 次讀書", Requirement.SESSION_COUNT, 100);

    private final String displayName;
    private final String description;
    private final Requirement requirement;
    private final long requiredValue;

    BadgeDef(String displayName, String description, Requirement requirement, long requiredValue) {
        this.displayName = displayName;
        this.description = description;
        this.requirement = requirement;
        this.requiredValue = requiredValue;
    }

    public enum Requirement {
        SESSION_COUNT,
        STREAK_DAYS,
        DAILY_MINUTES,
        LEVEL,
        TOTAL_XP
    }
}

package com.aiinpocket.studyquest.service.audit;

import com.aiinpocket.studyquest.model.dto.AuditAnalysis;
import com.aiinpocket.studyquest.model.dto.DetectedAnomaly;
import com.aiinpocket.studyquest.model.entity.SessionEvent;
import com.aiinpocket.studyquest.model.enums.AnomalyType;
import com.aiinpocket.studyquest.model.enums.RiskLevel;
import com.aiinpocket.studyquest.model.enums.SessionEventType;
import com.aiinpocket.studyquest.model.enums.Severity;
import com.aiinpocket.studyquest.service.audit.EventPayloadInspector.PayloadInspection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Session 事件軌跡的樣式分析器（純計算，不讀寫資料庫）。
 *
 * <p>patternScore 從 100 開始，依 {@link AnomalyType} 計分表逐項扣分，最低為 0：
 * <ul>
 *   <li>相鄰事件間隔超過 10 分鐘且後一個事件不是 END：每一段扣一次</li>
 *   <li>相鄰事件間隔超過 30 分鐘：每一段再扣一次（不論是否為 END）</li>
 *   <li>缺少 START / END、心跳比例不在 [0.3, 0.8]、重複事件、payload 不合法、多個裝置、
 *       時長過短（&lt;5 分鐘）或過長（&gt;480 分鐘）：各最多扣一次</li>
 * </ul>
 * 沒有任何事件時 patternScore 直接為 0，風險為 CRITICAL。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionAuditAnalyzer {

    static final long LARGE_GAP_SECONDS = 600;
    static final long INACTIVITY_GAP_SECONDS = 1800;
    static final double HEARTBEAT_RATIO_MIN = 0.3;
    static final double HEARTBEAT_RATIO_MAX = 0.8;
    static final int SHORT_SESSION_MINUTES = 5;
    static final int LONG_SESSION_MINUTES = 480;

    private final EventPayloadInspector payloadInspector;

    /**
     * 分析一個 session 的事件軌跡。
     *
     * @param events           依 created_at 排序的事件
     * @param durationMinutes  session 記錄的時長；為 null 時改用第一個到最後一個事件的時間差
     * @param expectedDeviceId 預期的裝置識別，可為 null
     */
    public AuditAnalysis analyze(List<SessionEvent> events, Integer durationMinutes, String expectedDeviceId) {
        if (events == null || events.isEmpty()) {
            return new AuditAnalysis(0, List.of(), RiskLevel.CRITICAL,
                    List.of("這次沒有收到任何讀書紀錄事件，請確認 App 在讀書期間保持開啟"));
        }

        List<DetectedAnomaly> anomalies = new ArrayList<>();
        detectGaps(events, anomalies);
        detectMissingBoundaries(events, anomalies);
        detectHeartbeatRatio(events, anomalies);
        detectDuplicates(events, anomalies);
        detectPayloadProblems(events, expectedDeviceId, anomalies);
        detectDuration(events, durationMinutes, anomalies);

        int patternScore = patternScore(anomalies);

        RiskLevel risk = assessRisk(anomalies);
        List<String> recommendations = recommend(anomalies, risk);

        log.debug("[稽核] 事件 {} 筆, patternScore={}, 異常={}, 風險={}",
                events.size(), patternScore, anomalies.size(), risk);
        return new AuditAnalysis(patternScore, List.copyOf(anomalies), risk, recommendations);
    }

    /**
     * 從 100 扣分：perOccurrence 的樣式每個發生點各扣一次，其餘每個 session 最多扣一次。
     */
    static int patternScore(List<DetectedAnomaly> anomalies) {
        Set<AnomalyType> charged = EnumSet.noneOf(AnomalyType.class);
        int score = 100;
        for (DetectedAnomaly anomaly : anomalies) {
            AnomalyType type = anomaly.type();
            if (type.isPerOccurrence() || charged.add(type)) {
                score -= type.getWeight();
            }
        }
        return Math.max(score, 0);
    }

    // ===== 各項偵測 =====

    private void detectGaps(List<SessionEvent> events, List<DetectedAnomaly> anomalies) {
        for (int i = 1; i < events.size(); i++) {
            SessionEvent event = events.get(i);
            long gap = Duration.between(events.get(i - 1).getCreatedAt(), event.getCreatedAt()).getSeconds();
            if (gap > LARGE_GAP_SECONDS && event.getEventType() != SessionEventType.END) {
                anomalies.add(new DetectedAnomaly(AnomalyType.LARGE_TIME_GAP,
                        "第 " + (i + 1) + " 個事件前間隔 " + gap + " 秒"));
            }
            if (gap > INACTIVITY_GAP_SECONDS) {
                anomalies.add(new DetectedAnomaly(AnomalyType.EXTENDED_INACTIVITY,
                        String.format("閒置 %.1f 分鐘", gap / 60.0)));
            }
        }
    }

    private void detectMissingBoundaries(List<SessionEvent> events, List<DetectedAnomaly> anomalies) {
        Set<SessionEventType> types = EnumSet.noneOf(SessionEventType.class);
        events.forEach(e -> types.add(e.getEventType()));
        if (!types.contains(SessionEventType.START)) {
            anomalies.add(new DetectedAnomaly(AnomalyType.MISSING_START, "沒有 START 事件"));
        }
        if (!types.contains(SessionEventType.END)) {
            anomalies.add(new DetectedAnomaly(AnomalyType.MISSING_END, "沒有 END 事件"));
        }
    }

    private void detectHeartbeatRatio(List<SessionEvent> events, List<DetectedAnomaly> anomalies) {
        long heartbeats = events.stream().filter(e -> e.getEventType() == SessionEventType.HEARTBEAT).count();
        double ratio = (double) heartbeats / events.size();
        if (ratio < HEARTBEAT_RATIO_MIN || ratio > HEARTBEAT_RATIO_MAX) {
            anomalies.add(new DetectedAnomaly(AnomalyType.IRREGULAR_HEARTBEAT,
                    String.format("心跳比例 %.2f 不在 %.1f~%.1f", ratio, HEARTBEAT_RATIO_MIN, HEARTBEAT_RATIO_MAX)));
        }
    }

    private void detectDuplicates(List<SessionEvent> events, List<DetectedAnomaly> anomalies) {
        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        for (SessionEvent event : events) {
            if (!seen.add(event.getEventType() + "@" + event.getCreatedAt())) {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            anomalies.add(new DetectedAnomaly(AnomalyType.DUPLICATE_EVENT, duplicates + " 筆重複事件"));
        }
    }

    private void detectPayloadProblems(List<SessionEvent> events, String expectedDeviceId,
                                       List<DetectedAnomaly> anomalies) {
        Set<String> devices = new LinkedHashSet<>();
        if (expectedDeviceId != null && !expectedDeviceId.isBlank()) {
            devices.add(expectedDeviceId);
        }
        String firstInvalidReason = null;
        int invalid = 0;
        for (SessionEvent event : events) {
            PayloadInspection inspection = payloadInspector.inspect(event.getPayload());
            if (!inspection.valid()) {
                invalid++;
                if (firstInvalidReason == null) {
                    firstInvalidReason = inspection.reason();
                }
            } else if (inspection.deviceId() != null) {
                devices.add(inspection.deviceId());
            }
        }
        if (invalid > 0) {
            anomalies.add(new DetectedAnomaly(AnomalyType.INVALID_PAYLOAD,
                    invalid + " 筆 payload 不合法（" + firstInvalidReason + "）"));
        }
        if (devices.size() > 1) {
            anomalies.add(new DetectedAnomaly(AnomalyType.MULTIPLE_DEVICES, "偵測到 " + devices.size() + " 個裝置"));
        }
    }

    private void detectDuration(List<SessionEvent> events, Integer durationMinutes, List<DetectedAnomaly> anomalies) {
        double minutes;
        if (durationMinutes != null) {
            minutes = durationMinutes;
        } else if (events.size() >= 2) {
            Instant first = events.get(0).getCreatedAt();
            Instant last = events.get(events.size() - 1).getCreatedAt();
            minutes = Duration.between(first, last).getSeconds() / 60.0;
        } else {
            return;
        }
        if (minutes < SHORT_SESSION_MINUTES) {
            anomalies.add(new DetectedAnomaly(AnomalyType.VERY_SHORT_DURATION,
                    String.format("時長 %.1f 分鐘", minutes)));
        } else if (minutes > LONG_SESSION_MINUTES) {
            anomalies.add(new DetectedAnomaly(AnomalyType.EXTENDED_DURATION,
                    String.format("時長 %.1f 小時", minutes / 60)));
        }
    }

    // ===== 風險與建議 =====

    static RiskLevel assessRisk(List<DetectedAnomaly> anomalies) {
        long high = anomalies.stream().filter(a -> a.type().getSeverity() == Severity.HIGH).count();
        boolean anyMedium = anomalies.stream().anyMatch(a -> a.type().getSeverity() == Severity.MEDIUM);
        if (high >= 2) return RiskLevel.CRITICAL;
        if (high == 1) return RiskLevel.HIGH;
        if (anyMedium) return RiskLevel.MEDIUM;
        if (!anomalies.isEmpty()) return RiskLevel.LOW;
        return RiskLevel.MINIMAL;
    }

    /** 非懲罰性的建議文字 */
    private static List<String> recommend(List<DetectedAnomaly> anomalies, RiskLevel risk) {
        if (anomalies.isEmpty()) {
            return List.of("讀書節奏穩定，繼續保持！");
        }
        Set<AnomalyType> types = EnumSet.noneOf(AnomalyType.class);
        anomalies.forEach(a -> types.add(a.type()));

        List<String> tips = new ArrayList<>();
        if (types.contains(AnomalyType.LARGE_TIME_GAP)) {
            tips.add("盡量減少讀書中途的長時間停頓，專注度會更好");
            tips.add("被打斷時試著盡快回來，保持讀書節奏");
        }
        if (types.contains(AnomalyType.MISSING_START) || types.contains(AnomalyType.MISSING_END)) {
            tips.add("讀書期間請讓 App 保持開啟");
            tips.add("檢查裝置的電量與網路設定，避免紀錄中斷");
        }
        if (types.contains(AnomalyType.IRREGULAR_HEARTBEAT)) {
            tips.add("讀書節奏有些起伏，這很正常");
            tips.add("需要的話可以設定定時提醒");
        }
        if (types.contains(AnomalyType.VERY_SHORT_DURATION)) {
            tips.add("短時間的讀書也是在累積，每一次都算數");
        }
        if (types.contains(AnomalyType.EXTENDED_DURATION)) {
            tips.add("這次讀書時間很長，記得適時休息");
        }
        if (risk == RiskLevel.MEDIUM || risk == RiskLevel.HIGH) {
            tips.add("偶爾的不規律很常見，持之以恆比完美更重要");
        }
        return List.copyOf(tips);
    }
}

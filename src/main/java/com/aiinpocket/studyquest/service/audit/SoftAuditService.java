package com.aiinpocket.studyquest.service.audit;

import com.aiinpocket.studyquest.config.GamificationProperties;
import com.aiinpocket.studyquest.gateway.EventStoreGateway;
import com.aiinpocket.studyquest.model.dto.AuditAnalysis;
import com.aiinpocket.studyquest.model.dto.AuditResult;
import com.aiinpocket.studyquest.model.dto.DetectedAnomaly;
import com.aiinpocket.studyquest.model.dto.ForgivenessProfile;
import com.aiinpocket.studyquest.model.dto.UserGameState;
import com.aiinpocket.studyquest.model.entity.SessionAudit;
import com.aiinpocket.studyquest.model.entity.SessionEvent;
import com.aiinpocket.studyquest.model.entity.StudySession;
import com.aiinpocket.studyquest.model.enums.ValidationMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;

/**
 * 軟性稽核服務。
 * 把事件軌跡分析結果轉成懷疑分數，依使用者歷史套用寬恕，再依驗證模式判定是否通過。
 *
 * <p>稽核永遠不會阻擋獎勵發放：{@link #evaluate} 內部任何錯誤都只記錄 WARN，
 * 並回傳「有效、分數 0」的安全預設值。
 */
@Service
@Slf4j
public class SoftAuditService {

    private final SessionAuditAnalyzer analyzer;
    private final ForgivenessCalculator forgivenessCalculator;
    private final EventStoreGateway gateway;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final GamificationProperties.AuditParams auditParams;

    public SoftAuditService(SessionAuditAnalyzer analyzer,
                            ForgivenessCalculator forgivenessCalculator,
                            EventStoreGateway gateway,
                            ObjectMapper objectMapper,
                            Clock clock,
                            GamificationProperties properties) {
        this.analyzer = analyzer;
        this.forgivenessCalculator = forgivenessCalculator;
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.auditParams = properties.audit();
    }

    /**
     * 稽核一個已完成的 session。不會拋出例外。
     */
    public AuditResult evaluate(UserGameState user, StudySession session, List<SessionEvent> events,
                                ValidationMode mode, String expectedDeviceId) {
        try {
            AuditAnalysis analysis = analyzer.analyze(events, session.getDurationMinutes(), expectedDeviceId);
            ForgivenessProfile forgiveness = forgivenessFor(user);

            int base = analysis.suspicionScore();
            int adjusted = applyForgiveness(base, forgiveness.total());
            boolean valid = mode.passes(adjusted);

            List<String> anomalies = analysis.anomalies().stream().map(DetectedAnomaly::toString).toList();
            AuditResult result = new AuditResult(valid, base, adjusted, forgiveness.total(), mode,
                    analysis.risk(), anomalies, analysis.recommendations(),
                    buildMessage(valid, adjusted, mode, forgiveness.total()), false);

            if (!valid) {
                log.info("[稽核] session {} 標記待複查: 分數 {}/{} (原始 {}, 寬恕 {}), 風險 {}",
                        session.getId(), adjusted, mode.getThreshold(), base,
                        String.format("%.2f", forgiveness.total()), analysis.risk());
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("[稽核] session {} 分析失敗，改用安全預設值: {}", session.getId(), e.getMessage(), e);
            return AuditResult.safeDefault(mode);
        }
    }

    /**
     * 寫入稽核紀錄。安全預設值（分析失敗）不寫入，避免以假分數污染寬恕歷史。
     */
    public void record(UUID userId, UUID sessionId, AuditResult result) {
        if (result.fallback()) {
            return;
        }
        gateway.appendAuditRecord(SessionAudit.builder()
                .sessionId(sessionId)
                .userId(userId)
                .baseSuspicionScore(result.baseSuspicionScore())
                .suspicionScore(result.adjustedScore())
                .reasons(objectMapper.writeValueAsString(result.anomalies()))
                .flagged(result.flagged())
                .forgivenessApplied(result.forgiveness())
                .validationMode(result.mode())
                .riskLevel(result.risk())
                .createdAt(clock.instant())
                .build());
    }

    /**
     * 查詢使用者的寬恕明細。
     */
    public ForgivenessProfile getForgivenessProfile(UUID userId) {
        UserGameState user = gateway.fetchUserStats(userId)
                .orElseThrow(() -> new NoSuchElementException("使用者不存在: " + userId));
        return forgivenessFor(user);
    }

    /** 最終分數 = round(懷疑分數 × (1 − 寬恕))，四捨五入 */
    static int applyForgiveness(int suspicionScore, double forgiveness) {
        return (int) Math.round(suspicionScore * (1 - forgiveness));
    }

    // ===== 內部方法 =====

    private ForgivenessProfile forgivenessFor(UserGameState user) {
        Instant since = clock.instant().minus(Duration.ofDays(auditParams.historyDays()));
        List<Integer> scores;
        try {
            scores = gateway.fetchRecentAuditScores(user.userId(), since);
        } catch (RuntimeException e) {
            log.warn("[稽核] 讀取使用者 {} 稽核歷史失敗，乾淨紀錄寬恕以 0 計算: {}", user.userId(), e.getMessage());
            scores = List.of();
        }
        return forgivenessCalculator.calculate(user.currentStreak(), user.totalXp(), scores,
                auditParams.cleanScoreThreshold());
    }

    private static String buildMessage(boolean valid, int score, ValidationMode mode, double forgiveness) {
        String head = valid
                ? String.format("讀書紀錄驗證通過（分數 %d/%d）", score, mode.getThreshold())
                : String.format("讀書紀錄已標記待複查（分數 %d/%d），獎勵照常發放", score, mode.getThreshold());
        if (forgiveness > 0) {
            return head + String.format("，已套用 %.1f%% 寬恕", forgiveness * 100);
        }
        return head;
    }
}

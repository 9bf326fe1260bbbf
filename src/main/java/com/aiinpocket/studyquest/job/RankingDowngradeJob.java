package com.aiinpocket.studyquest.job;

import com.aiinpocket.studyquest.service.DistributedLockService;
import com.aiinpocket.studyquest.service.ranking.RankingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quartz.JobExecutionContext;
import org.springframework.scheduling.quartz.QuartzJobBean;
import org.springframework.stereotype.Component;

/**
 * 段位閒置降級排程（每日）。
 * 逐一檢查非 BRONZE 使用者，閒置超過段位門檻者依目前 XP 與連續天數重新判定段位。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RankingDowngradeJob extends QuartzJobBean {

    private final RankingService rankingService;
    private final DistributedLockService lockService;

    /** Advisory lock ID: RankingDowngradeJob 專用 */
    static final long DOWNGRADE_LOCK_ID = 3_100_001L;

    @Override
    protected void executeInternal(JobExecutionContext context) {
        lockService.executeWithLock(DOWNGRADE_LOCK_ID, "RankingDowngradeJob", () -> {
            log.info("[排名] 開始執行閒置降級排程");
            try {
                int downgraded = rankingService.processDowngrades();
                log.info("[排名] 閒置降級排程完成，降級 {} 人", downgraded);
            } catch (Exception e) {
                log.error("[排名] 閒置降級排程失敗: {}", e.getMessage(), e);
            }
        });
    }
}

package com.aiinpocket.studyquest.config;

import com.aiinpocket.studyquest.job.RankingDowngradeJob;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDetail;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.TimeZone;

@Configuration
public class QuartzConfig {

    // RankingDowngradeJob：每日檢查閒置使用者的段位（預設 UTC 19:00，即 +05:30 的 00:30）
    @Bean
    public JobDetail rankingDowngradeJobDetail() {
        return JobBuilder.newJob(RankingDowngradeJob.class)
                .withIdentity("rankingDowngradeJob", "ranking")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger rankingDowngradeTrigger(JobDetail rankingDowngradeJobDetail,
                                           @Value("${gamification.ranking.downgrade-cron:0 0 19 * * ?}") String cron) {
        return TriggerBuilder.newTrigger()
                .forJob(rankingDowngradeJobDetail)
                .withIdentity("rankingDowngradeTrigger", "ranking")
                .withSchedule(CronScheduleBuilder.cronSchedule(cron).inTimeZone(TimeZone.getTimeZone("UTC")))
                .build();
    }
}

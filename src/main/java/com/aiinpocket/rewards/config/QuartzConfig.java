package com.aiinpocket.rewards.config;

import com.aiinpocket.rewards.job.ChallengeExpiryJob;
import com.aiinpocket.rewards.job.ChallengeValidationJob;
import com.aiinpocket.rewards.job.LevelRecalculationJob;
import com.aiinpocket.rewards.job.WeeklyPayoutJob;
import lombok.RequiredArgsConstructor;
import org.quartz.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.TimeZone;

/**
 * 排程設定。cron 來自 rewards.schedule，依 rewards.zone-id 的時區觸發。
 */
@Configuration
@RequiredArgsConstructor
public class QuartzConfig {

    private final RewardEngineProperties properties;

    // 挑戰驗證：預設每 15 分鐘
    @Bean
    public JobDetail challengeValidationJobDetail() {
        return JobBuilder.newJob(ChallengeValidationJob.class)
                .withIdentity("challengeValidationJob", "rewards")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger challengeValidationTrigger(JobDetail challengeValidationJobDetail) {
        return cronTrigger(challengeValidationJobDetail, "challengeValidationTrigger",
                properties.schedule().validationCron());
    }

    // 等級重算：預設每天 03:30
    @Bean
    public JobDetail levelRecalculationJobDetail() {
        return JobBuilder.newJob(LevelRecalculationJob.class)
                .withIdentity("levelRecalculationJob", "rewards")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger levelRecalculationTrigger(JobDetail levelRecalculationJobDetail) {
        return cronTrigger(levelRecalculationJobDetail, "levelRecalculationTrigger",
                properties.schedule().levelRecalculationCron());
    }

    // 挑戰到期：預設每小時第 5 分
    @Bean
    public JobDetail challengeExpiryJobDetail() {
        return JobBuilder.newJob(ChallengeExpiryJob.class)
                .withIdentity("challengeExpiryJob", "rewards")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger challengeExpiryTrigger(JobDetail challengeExpiryJobDetail) {
        return cronTrigger(challengeExpiryJobDetail, "challengeExpiryTrigger",
                properties.schedule().expiryCron());
    }

    // 每週發放：預設週一 06:00
    @Bean
    public JobDetail weeklyPayoutJobDetail() {
        return JobBuilder.newJob(WeeklyPayoutJob.class)
                .withIdentity("weeklyPayoutJob", "rewards")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger weeklyPayoutTrigger(JobDetail weeklyPayoutJobDetail) {
        return cronTrigger(weeklyPayoutJobDetail, "weeklyPayoutTrigger",
                properties.schedule().weeklyPayoutCron());
    }

    private Trigger cronTrigger(JobDetail jobDetail, String name, String cron) {
        return TriggerBuilder.newTrigger()
                .forJob(jobDetail)
                .withIdentity(name, "rewards")
                .withSchedule(CronScheduleBuilder.cronSchedule(cron)
                        .inTimeZone(TimeZone.getTimeZone(properties.zone())))
                .build();
    }
}

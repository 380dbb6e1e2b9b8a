/*
 * Where: Cron application wiring
 * What: Builds the job registry from an explicit list of jobs
 * Why: Job order and membership are fixed at startup, never discovered at runtime
 */
package com.manageros.cron.config;

import com.manageros.cron.job.CronJobRegistry;
import com.manageros.cron.job.impl.ActivityMonitoringJob;
import com.manageros.cron.job.impl.BirthdayNotificationJob;
import com.manageros.cron.job.impl.OverdueTasksNotificationJob;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CronJobConfig {

  private static final Logger logger = LoggerFactory.getLogger(CronJobConfig.class);

  @Bean
  CronJobRegistry cronJobRegistry(
      Clock clock,
      CronJobsProperties jobsProperties,
      BirthdayNotificationJob birthdayNotificationJob,
      ActivityMonitoringJob activityMonitoringJob,
      OverdueTasksNotificationJob overdueTasksNotificationJob) {
    final CronJobRegistry registry =
        new CronJobRegistry(clock, jobsProperties.asRegistryOverrides());
    registry.register(birthdayNotificationJob);
    registry.register(activityMonitoringJob);
    registry.register(overdueTasksNotificationJob);
    logger.info(
        "cron job registry ready jobs={} overrides={}",
        registry.jobIds(),
        jobsProperties.overrides().keySet());
    return registry;
  }
}

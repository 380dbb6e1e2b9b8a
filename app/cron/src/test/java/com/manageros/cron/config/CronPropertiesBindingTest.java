package com.manageros.cron.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.assertj.core.util.Throwables;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class CronPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void defaultsApplyWhenNothingIsConfigured() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          assertThat(context.getBean(CronRunnerProperties.class).parallelism()).isEqualTo(1);
          assertThat(context.getBean(CronRetentionProperties.class).retentionDays())
              .isEqualTo(90);
          final CronExecutionProperties execution = context.getBean(CronExecutionProperties.class);
          assertThat(execution.errorMessageMaxLength()).isEqualTo(2000);
          assertThat(execution.maxListLimit()).isEqualTo(500);
          assertThat(context.getBean(CronTriggerProperties.class).isSecretConfigured()).isFalse();
          assertThat(context.getBean(CronJobsProperties.class).overrides()).isEmpty();
        });
  }

  @Test
  void jobOverridesBindPerJobId() {
    contextRunner
        .withPropertyValues(
            "cron.jobs.overrides.birthday-notification.days-ahead=14",
            "cron.jobs.overrides.activity-monitoring.days-back=30",
            "cron.runner.parallelism=4",
            "cron.trigger.secret=s3cret")
        .run(
            context -> {
              assertThat(context).hasNotFailed();
              final Map<String, Map<String, Object>> overrides =
                  context.getBean(CronJobsProperties.class).asRegistryOverrides();
              assertThat(overrides.get("birthday-notification"))
                  .containsEntry("days-ahead", "14");
              assertThat(overrides.get("activity-monitoring")).containsEntry("days-back", "30");
              assertThat(context.getBean(CronRunnerProperties.class).parallelism()).isEqualTo(4);
              assertThat(context.getBean(CronTriggerProperties.class).isSecretConfigured())
                  .isTrue();
            });
  }

  @Test
  void contextFailsWhenParallelismIsTooHigh() {
    contextRunner
        .withPropertyValues("cron.runner.parallelism=100")
        .run(
            context -> {
              assertThat(context).hasFailed();
              final Throwable root = Throwables.getRootCause(context.getStartupFailure());
              assertThat(root).isInstanceOf(BindValidationException.class);
              assertThat(root.getMessage()).contains("parallelism");
            });
  }

  @Configuration
  @EnableConfigurationProperties({
    CronRunnerProperties.class,
    CronRetentionProperties.class,
    CronExecutionProperties.class,
    CronTriggerProperties.class,
    CronJobsProperties.class
  })
  static class TestConfiguration {}
}

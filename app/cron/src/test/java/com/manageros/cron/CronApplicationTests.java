package com.manageros.cron;

import static org.assertj.core.api.Assertions.assertThat;

import com.manageros.cron.job.CronJobRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class CronApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private CronJobRegistry registry;

  @Test
  void contextLoadsWithJobsInRegistrationOrder() {
    assertThat(registry.jobIds())
        .containsExactly(
            "birthday-notification", "activity-monitoring", "overdue-tasks-notification");
  }
}

package com.manageros.cron.api;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.manageros.common.config.TimeConfig;
import com.manageros.cron.config.CronSecurityConfig;
import com.manageros.cron.job.CronJobRegistry;
import com.manageros.cron.service.CronJobExecutionService;
import com.manageros.cron.service.CronRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/** An unset trigger secret is a deployment error, not an authentication failure. */
@WebMvcTest(CronTriggerController.class)
@AutoConfigureMockMvc
@Import({CronSecurityConfig.class, TimeConfig.class})
@TestPropertySource(properties = "cron.trigger.secret=")
class CronTriggerSecretMissingTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private CronRunner cronRunner;
  @MockitoBean private CronJobRegistry registry;
  @MockitoBean private CronJobExecutionService executionService;

  @Test
  void triggerAnswersServerErrorWhenSecretUnset() throws Exception {
    mockMvc
        .perform(get("/api/cron/notifications").header("Authorization", "Bearer anything"))
        .andExpect(status().isInternalServerError());

    verifyNoInteractions(cronRunner);
  }

  @Test
  void readEndpointsAlsoRequireConfiguredSecret() throws Exception {
    mockMvc.perform(get("/api/cron/jobs")).andExpect(status().isInternalServerError());
  }
}

/*
 * Where: Cron application entry point
 * What: Boots Spring and, under the cli profile, exits with the batch run's status
 * Why: One artifact serves both the HTTP trigger and the command line runner
 */
package com.manageros.cron;

import com.manageros.common.config.TimeConfig;
import com.manageros.cron.cli.CronRunnerCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class CronApplication {

  public static void main(String[] args) {
    final ConfigurableApplicationContext context =
        SpringApplication.run(CronApplication.class, args);
    if (context.getBeanNamesForType(CronRunnerCommand.class).length > 0) {
      System.exit(SpringApplication.exit(context));
    }
  }
}

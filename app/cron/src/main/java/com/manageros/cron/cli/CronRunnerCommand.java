/*
 * Where: Cron command line entry
 * What: Parses run options, drives the batch runner and prints one line per job/organization
 * Why: Lets an OS-level cron trigger run the batch without the HTTP API
 */
package com.manageros.cron.cli;

import com.manageros.cron.job.CronJob;
import com.manageros.cron.job.CronJobRegistry;
import com.manageros.cron.service.CronRunOutcome;
import com.manageros.cron.service.CronRunRequest;
import com.manageros.cron.service.CronRunSummary;
import com.manageros.cron.service.CronRunner;
import java.io.PrintStream;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "cron.cli.enabled", havingValue = "true")
public class CronRunnerCommand implements ApplicationRunner, ExitCodeGenerator {

  private static final Logger logger = LoggerFactory.getLogger(CronRunnerCommand.class);

  static final String OPTION_JOB = "job";
  static final String OPTION_ORG = "org";
  static final String OPTION_VERBOSE = "verbose";
  static final String OPTION_DRY_RUN = "dry-run";
  static final String OPTION_HELP = "help";
  private static final Set<String> KNOWN_OPTIONS =
      Set.of(OPTION_JOB, OPTION_ORG, OPTION_VERBOSE, OPTION_DRY_RUN, OPTION_HELP);

  private final CronRunner cronRunner;
  private final CronJobRegistry registry;
  private final PrintStream out;
  private volatile int exitCode;

  @Autowired
  public CronRunnerCommand(CronRunner cronRunner, CronJobRegistry registry) {
    this(cronRunner, registry, System.out);
  }

  CronRunnerCommand(CronRunner cronRunner, CronJobRegistry registry, PrintStream out) {
    this.cronRunner = cronRunner;
    this.registry = registry;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) {
    exitCode = execute(args);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  int execute(ApplicationArguments args) {
    final Set<String> unknown = new TreeSet<>();
    for (String option : args.getOptionNames()) {
      // dotted names are Spring properties (spring.profiles.active, cron.cli.enabled)
      if (!KNOWN_OPTIONS.contains(option) && option.indexOf('.') < 0) {
        unknown.add(option);
      }
    }
    unknown.addAll(args.getNonOptionArgs());
    if (!unknown.isEmpty()) {
      out.println("Unknown argument(s): " + String.join(", ", unknown));
      printHelp();
      return 1;
    }
    if (args.containsOption(OPTION_HELP)) {
      printHelp();
      return 0;
    }

    final boolean verbose = args.containsOption(OPTION_VERBOSE);
    final CronRunRequest request =
        new CronRunRequest(
            singleValue(args, OPTION_JOB),
            singleValue(args, OPTION_ORG),
            args.containsOption(OPTION_DRY_RUN));
    try {
      if (verbose) {
        out.println("Starting cron job execution...");
        if (request.dryRun()) {
          out.println("Dry run: notifications will be reported but not created");
        }
      }
      final CronRunSummary summary = cronRunner.run(request);
      for (CronRunOutcome outcome : summary.results()) {
        printOutcome(outcome, verbose);
      }
      if (verbose) {
        out.println();
      }
      out.println(
          "Summary: "
              + summary.successfulJobs()
              + "/"
              + summary.totalJobs()
              + " succeeded, "
              + summary.failedJobs()
              + " failed, "
              + summary.totalNotifications()
              + " notifications created");
      return 0;
    } catch (RuntimeException ex) {
      logger.error("cron run aborted", ex);
      out.println("Cron job execution failed: " + ex.getMessage());
      return 1;
    }
  }

  private void printOutcome(CronRunOutcome outcome, boolean verbose) {
    out.println(
        (outcome.success() ? "✅" : "❌")
            + " "
            + outcome.jobId()
            + "@"
            + outcome.organizationId()
            + ": "
            + outcome.notificationsCreated()
            + " notifications created");
    if (verbose && !outcome.metadata().isEmpty()) {
      out.println("   Metadata: " + outcome.metadata());
    }
    if (outcome.error() != null) {
      out.println("   Error: " + outcome.error());
    }
  }

  private void printHelp() {
    out.println("Usage: cron [options]");
    out.println();
    out.println("Options:");
    out.println("  --job=<id>     Run only the job with this id");
    out.println("  --org=<id>     Run only for this organization");
    out.println("  --verbose      Print job metadata for every result");
    out.println("  --dry-run      Report notifications without creating them");
    out.println("  --help         Show this help");
    out.println();
    out.println("Available jobs:");
    for (CronJob job : registry.getAllJobs()) {
      out.println("  " + job.id() + " - " + job.name() + " (" + job.schedule() + ")");
    }
  }

  private static String singleValue(ApplicationArguments args, String option) {
    final List<String> values = args.getOptionValues(option);
    if (values == null || values.isEmpty()) {
      return null;
    }
    return values.get(values.size() - 1);
  }
}

package com.autoapply.tool.easyapply.runner;

import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.config.EasyApplyConfig.RunnerProperties;
import com.autoapply.tool.easyapply.browser.UiDriver;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.autoapply.tool.easyapply.ledger.ApplicationLedger;
import com.autoapply.tool.easyapply.session.SessionPersistence;
import com.autoapply.tool.easyapply.wizard.ApplicationWizard;
import com.autoapply.tool.easyapply.wizard.dto.ApplicationOutcome;
import com.autoapply.tool.easyapply.wizard.enums.OutcomeStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies to every job of the prepared job list that has not been applied to yet.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "easy-apply.runner", name = "enabled", havingValue = "true")
public class EasyApplyRunner implements CommandLineRunner {

  private final JobListLoader jobListLoader;
  private final ApplicationWizard applicationWizard;
  private final ApplicationLedger applicationLedger;
  private final SessionPersistence sessionPersistence;
  private final UiDriver uiDriver;
  private final EasyApplyProperties properties;

  @Override
  public void run(String... args) {
    RunnerProperties runner = properties.getRunner();
    String jobsFile = args.length > 0 ? args[0] : runner.getJobsFile();
    List<JobContext> jobs = jobListLoader.load(Paths.get(jobsFile));

    sessionPersistence.restore();
    sessionPersistence.start();

    Map<OutcomeStatus, Integer> totals = new EnumMap<>(OutcomeStatus.class);
    int skipped = 0;
    try {
      for (JobContext job : jobs) {
        if (applicationLedger.isApplied(job.getId())) {
          log.info("Already applied to {} (ID: {}), skipping", job.displayName(), job.getId());
          skipped++;
          continue;
        }
        try {
          uiDriver.navigateTo(job.getUrl());
        } catch (UiInteractionException e) {
          log.error("Could not open job page {}: {}", job.getUrl(), e.getMessage());
          continue;
        }
        ApplicationOutcome outcome = applicationWizard.startApplication(job);
        totals.merge(outcome.getStatus(), 1, Integer::sum);
        uiDriver.waitForTimeout(runner.getPauseBetweenJobs().toMillis());
      }
    } finally {
      sessionPersistence.stop();
    }
    log.info("Run finished: {} successful, {} failed, {} incomplete, {} skipped",
        totals.getOrDefault(OutcomeStatus.SUCCESS, 0),
        totals.getOrDefault(OutcomeStatus.FAILURE, 0),
        totals.getOrDefault(OutcomeStatus.INCOMPLETE, 0), skipped);
  }
}

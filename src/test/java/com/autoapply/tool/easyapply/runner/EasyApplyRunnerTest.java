package com.autoapply.tool.easyapply.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.browser.fake.FakeUiDriver;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.autoapply.tool.easyapply.ledger.ApplicationLedger;
import com.autoapply.tool.easyapply.session.SessionPersistence;
import com.autoapply.tool.easyapply.wizard.ApplicationWizard;
import com.autoapply.tool.easyapply.wizard.dto.ApplicationOutcome;

@ExtendWith(MockitoExtension.class)
class EasyApplyRunnerTest {

  @Mock
  private JobListLoader jobListLoader;

  @Mock
  private ApplicationWizard applicationWizard;

  @Mock
  private ApplicationLedger applicationLedger;

  @Mock
  private SessionPersistence sessionPersistence;

  private FakeUiDriver uiDriver;
  private EasyApplyRunner runner;

  private final JobContext applied = JobContext.builder().id("101")
      .url("https://www.linkedin.com/jobs/view/101").build();
  private final JobContext fresh = JobContext.builder().id("102")
      .url("https://www.linkedin.com/jobs/view/102").build();

  @BeforeEach
  void setUp() {
    uiDriver = new FakeUiDriver();
    runner = new EasyApplyRunner(jobListLoader, applicationWizard, applicationLedger,
        sessionPersistence, uiDriver, new EasyApplyProperties());
  }

  @Test
  void appliesOnlyToJobsNotYetApplied() {
    when(jobListLoader.load(Path.of("jobs.json"))).thenReturn(List.of(applied, fresh));
    when(applicationLedger.isApplied("101")).thenReturn(true);
    when(applicationLedger.isApplied("102")).thenReturn(false);
    when(applicationWizard.startApplication(fresh)).thenReturn(ApplicationOutcome.success(fresh));

    runner.run("jobs.json");

    verify(applicationWizard, never()).startApplication(applied);
    assertThat(uiDriver.getVisitedUrls()).containsExactly("https://www.linkedin.com/jobs/view/102");

    InOrder order = inOrder(sessionPersistence, applicationWizard);
    order.verify(sessionPersistence).restore();
    order.verify(sessionPersistence).start();
    order.verify(applicationWizard).startApplication(fresh);
    order.verify(sessionPersistence).stop();
  }

  @Test
  void sessionIsStoppedWhenTheRunFails() {
    when(jobListLoader.load(any())).thenReturn(List.of(fresh));
    when(applicationWizard.startApplication(fresh)).thenThrow(new IllegalStateException("boom"));

    assertThatThrownBy(() -> runner.run()).isInstanceOf(IllegalStateException.class);

    verify(sessionPersistence).stop();
  }
}

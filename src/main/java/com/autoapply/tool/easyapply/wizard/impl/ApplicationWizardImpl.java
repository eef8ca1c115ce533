package com.autoapply.tool.easyapply.wizard.impl;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import com.autoapply.common.util.LabelUtils;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.config.EasyApplyConfig.WizardProperties;
import com.autoapply.tool.easyapply.answer.AnswerStore;
import com.autoapply.tool.easyapply.browser.ElementSet;
import com.autoapply.tool.easyapply.browser.UiDriver;
import com.autoapply.tool.easyapply.browser.UiElement;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import com.autoapply.tool.easyapply.formstep.FormStepProcessor;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.autoapply.tool.easyapply.ledger.ApplicationLedger;
import com.autoapply.tool.easyapply.session.SessionPersistence;
import com.autoapply.tool.easyapply.wizard.ApplicationWizard;
import com.autoapply.tool.easyapply.wizard.ControlClicker;
import com.autoapply.tool.easyapply.wizard.EmergencyExitService;
import com.autoapply.tool.easyapply.wizard.RedirectGuard;
import com.autoapply.tool.easyapply.wizard.StepFingerprinter;
import com.autoapply.tool.easyapply.wizard.WizardSelectors;
import com.autoapply.tool.easyapply.wizard.dto.ApplicationOutcome;
import com.autoapply.tool.easyapply.wizard.dto.ControlCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Step loop of the application form.
 *
 * <p>
 * Each iteration finds the form container, compares its fingerprint with the previous one, fills
 * the visible fields and then clicks Submit or the best continue control. Repeated fingerprints,
 * repeated failed clicks and the step limit end the attempt through the emergency exit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationWizardImpl implements ApplicationWizard {

  private enum ContinueResult {
    ADVANCED, ALL_FAILED, NONE_FOUND
  }

  /**
   * Counters of one attempt
   */
  private static class AttemptState {
    int stepCount;
    int duplicateCount;
    int stuckCount;
    String lastFingerprint;
    final Set<Integer> clickedAlternates = new HashSet<>();

    int stepNumber() {
      return stepCount + 1;
    }
  }

  private final UiDriver uiDriver;
  private final FormStepProcessor formStepProcessor;
  private final AnswerStore answerStore;
  private final ControlClicker controlClicker;
  private final EmergencyExitService emergencyExitService;
  private final StepFingerprinter stepFingerprinter;
  private final RedirectGuard redirectGuard;
  private final ApplicationLedger applicationLedger;
  private final SessionPersistence sessionPersistence;
  private final EasyApplyProperties properties;

  @Override
  public ApplicationOutcome startApplication(JobContext jobContext) {
    log.info("Starting application for {} (ID: {})", jobContext.displayName(),
        jobContext.getId());
    ApplicationOutcome outcome;
    try {
      outcome = runAttempt(jobContext);
    } catch (RuntimeException e) {
      log.error("Application for {} aborted: {}", jobContext.displayName(), e.getMessage(), e);
      String message = StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName());
      outcome = ApplicationOutcome.failure(jobContext,
          message + closedSuffix(emergencyExitService.close()));
    }
    log.info("Application for {} finished: {} ({})", jobContext.displayName(),
        outcome.getStatus(), outcome.getReason());
    record(outcome);
    return outcome;
  }

  private ApplicationOutcome runAttempt(JobContext job) {
    WizardProperties wizard = properties.getWizard();
    AttemptState state = new AttemptState();

    Optional<ApplicationOutcome> entryFailure = triggerEntry(job);
    if (entryFailure.isPresent()) {
      return entryFailure.get();
    }

    while (true) {
      ElementSet modals = uiDriver.locate(WizardSelectors.MODAL).visible();
      if (modals.isEmpty()) {
        return exit(job, "modal disappeared at step " + state.stepNumber());
      }
      UiElement modal = modals.first();

      String fingerprint = stepFingerprinter.fingerprint(modal);
      if (fingerprint.equals(state.lastFingerprint)) {
        state.duplicateCount++;
        log.info("Step {} unchanged ({} repeats)", state.stepNumber(), state.duplicateCount);
        if (state.duplicateCount >= wizard.getDuplicateThreshold()) {
          if (!clickAlternate(modal, state)) {
            return exit(job, "Infinite loop detected at step " + state.stepNumber());
          }
          state.duplicateCount = 0;
          if (advance(state)) {
            return exit(job, "max steps reached");
          }
          continue;
        }
      } else {
        state.duplicateCount = 0;
        state.lastFingerprint = fingerprint;
      }

      log.info("Processing step {}", state.stepNumber());
      boolean filled = formStepProcessor.processFields(modal, job);
      if (!filled) {
        log.warn("Some fields on step {} were not filled", state.stepNumber());
      }
      answerStore.save();
      uiDriver.waitForTimeout(wizard.getFieldSettleWait().toMillis());

      Optional<UiElement> submit = findSubmit();
      if (submit.isPresent()) {
        return submit(job, submit.get());
      }

      ContinueResult result = clickContinue(modal);
      if (result == ContinueResult.NONE_FOUND) {
        return exit(job, "No working continue control on step " + state.stepNumber());
      }
      if (result == ContinueResult.ALL_FAILED) {
        state.stuckCount++;
        log.warn("No continue control worked on step {} ({} times)", state.stepNumber(),
            state.stuckCount);
        if (state.stuckCount >= wizard.getStuckThreshold()) {
          return exit(job, "stuck on step " + state.stepNumber());
        }
        uiDriver.waitForTimeout(wizard.getStepTransitionWait().toMillis());
        continue;
      }

      state.stuckCount = 0;
      if (advance(state)) {
        return exit(job, "max steps reached");
      }
    }
  }

  /**
   * Count a step advance and let the next step render
   *
   * @return true when the step limit is reached
   */
  private boolean advance(AttemptState state) {
    WizardProperties wizard = properties.getWizard();
    state.stepCount++;
    if (state.stepCount >= wizard.getMaxSteps()) {
      log.warn("Reached maximum of {} steps", wizard.getMaxSteps());
      return true;
    }
    uiDriver.waitForTimeout(wizard.getStepTransitionWait().toMillis());
    return false;
  }

  private Optional<ApplicationOutcome> triggerEntry(JobContext job) {
    WizardProperties wizard = properties.getWizard();
    if (job.isEntryAlreadyTriggered()) {
      uiDriver.waitForTimeout(wizard.getEntryRenderWait().toMillis());
      return Optional.empty();
    }

    ElementSet entry = uiDriver.locate(WizardSelectors.ENTRY);
    if (entry.isEmpty()) {
      log.warn("No entry control for {}", job.displayName());
      return Optional.of(ApplicationOutcome.failure(job, "No entry control found"));
    }
    if (!controlClicker.click(entry.first(), WizardSelectors.ENTRY, "entry control")) {
      return Optional.of(ApplicationOutcome.failure(job, "Entry control click failed"));
    }
    uiDriver.waitForTimeout(wizard.getEntryRenderWait().toMillis());

    return redirectGuard.checkAndReturn().map(reason -> ApplicationOutcome.failure(job, reason));
  }

  private Optional<UiElement> findSubmit() {
    for (String selector : List.of(WizardSelectors.SUBMIT, WizardSelectors.SUBMIT_BY_TEXT)) {
      ElementSet found = uiDriver.locate(selector).visible();
      if (!found.isEmpty()) {
        return Optional.of(found.first());
      }
    }
    return Optional.empty();
  }

  private ApplicationOutcome submit(JobContext job, UiElement submit) {
    WizardProperties wizard = properties.getWizard();
    if (!wizard.isAutoSubmit()) {
      log.info("Submit step reached for {}, auto-submit disabled", job.displayName());
      emergencyExitService.close();
      return ApplicationOutcome.incomplete(job, "Submit step reached with auto-submit disabled");
    }

    if (!controlClicker.click(submit, WizardSelectors.SUBMIT, "submit")) {
      return exit(job, "Submit click failed");
    }
    uiDriver.waitForTimeout(wizard.getSubmitWait().toMillis());

    Optional<UiElement> done = findDone();
    if (done.isEmpty()) {
      return exit(job, "No Done control after submission");
    }
    if (!controlClicker.click(done.get(), null, "done")) {
      log.warn("Done control found but could not be clicked");
    }
    return ApplicationOutcome.success(job);
  }

  /**
   * Done control inside the form container if it is still there, else anywhere on the page
   */
  private Optional<UiElement> findDone() {
    ElementSet modals = uiDriver.locate(WizardSelectors.MODAL).visible();
    if (!modals.isEmpty()) {
      UiElement modal = modals.first();
      for (String selector : WizardSelectors.DONE_IN_MODAL) {
        ElementSet found = modal.locate(selector).visible();
        if (!found.isEmpty()) {
          return Optional.of(found.first());
        }
      }
    }
    for (String selector : WizardSelectors.DONE_ON_PAGE) {
      ElementSet found = uiDriver.locate(selector).visible();
      if (!found.isEmpty()) {
        return Optional.of(found.first());
      }
    }
    return Optional.empty();
  }

  private ContinueResult clickContinue(UiElement modal) {
    boolean anyFound = false;
    for (ControlCandidate candidate : WizardSelectors.CONTINUE_CANDIDATES) {
      Optional<UiElement> control = locateCandidate(modal, candidate);
      if (control.isEmpty()) {
        continue;
      }
      anyFound = true;
      log.debug("Trying continue control {}", candidate.getName());
      if (controlClicker.click(control.get(), candidate.getPageSelector(), candidate.getName())) {
        log.info("Advanced with {}", candidate.getName());
        return ContinueResult.ADVANCED;
      }
    }
    return anyFound ? ContinueResult.ALL_FAILED : ContinueResult.NONE_FOUND;
  }

  private Optional<UiElement> locateCandidate(UiElement modal, ControlCandidate candidate) {
    try {
      ElementSet found = modal.locate(candidate.getSelector()).visible();
      if (found.isEmpty()) {
        return Optional.empty();
      }
      if (!candidate.isKeywordFiltered()) {
        return Optional.of(found.first());
      }
      UiElement match = null;
      for (UiElement element : found) {
        if (LabelUtils.containsAny(element.innerText(), candidate.getKeywords())) {
          match = element;
        }
      }
      return Optional.ofNullable(match);
    } catch (UiInteractionException e) {
      log.debug("Candidate {} lookup failed: {}", candidate.getName(), e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Click a forward-looking button other than the first one that was not clicked before in this
   * attempt
   */
  private boolean clickAlternate(UiElement modal, AttemptState state) {
    ElementSet buttons = modal.locate("button").visible();
    for (int i = 1; i < buttons.count(); i++) {
      if (state.clickedAlternates.contains(i)) {
        continue;
      }
      UiElement button = buttons.nth(i);
      String text;
      try {
        text = button.innerText();
      } catch (UiInteractionException e) {
        continue;
      }
      if (!LabelUtils.containsAny(text, WizardSelectors.ALTERNATE_KEYWORDS)) {
        continue;
      }
      state.clickedAlternates.add(i);
      log.info("Trying alternate control {} '{}'", i, StringUtils.normalizeSpace(text));
      if (controlClicker.click(button, null, "alternate control " + i)) {
        return true;
      }
    }
    return false;
  }

  private ApplicationOutcome exit(JobContext job, String reason) {
    log.warn("Abandoning application for {}: {}", job.displayName(), reason);
    boolean closed = emergencyExitService.close();
    return ApplicationOutcome.failure(job, reason + closedSuffix(closed));
  }

  private static String closedSuffix(boolean closed) {
    return " (form closed: " + closed + ")";
  }

  private void record(ApplicationOutcome outcome) {
    try {
      applicationLedger.record(outcome);
    } catch (RuntimeException e) {
      log.error("Could not record outcome for job {}: {}",
          outcome.getJob() != null ? outcome.getJob().getId() : null, e.getMessage());
    }
    try {
      sessionPersistence.saveNow(true);
    } catch (RuntimeException e) {
      log.warn("Session save after application failed: {}", e.getMessage());
    }
  }
}

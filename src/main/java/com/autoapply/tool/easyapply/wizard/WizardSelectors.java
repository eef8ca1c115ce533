package com.autoapply.tool.easyapply.wizard;

import java.util.List;
import com.autoapply.tool.easyapply.wizard.dto.ControlCandidate;

/**
 * Selectors for the job board's application form.
 */
public final class WizardSelectors {

  public static final String ENTRY = "button.jobs-apply-button";

  public static final String MODAL = "div.artdeco-modal__content.jobs-easy-apply-modal__content, "
      + "div.jobs-easy-apply-content";

  public static final String SUBMIT = "button[aria-label='Submit application']";
  public static final String SUBMIT_BY_TEXT =
      "xpath=//button[.//span[normalize-space()='Submit application'] "
          + "or normalize-space()='Submit application']";

  public static final List<String> DONE_IN_MODAL = List.of(
      "button[aria-label='Done'], button[aria-label='Dismiss']",
      "xpath=.//button[.//span[normalize-space()='Done'] or normalize-space()='Done']");

  public static final List<String> DONE_ON_PAGE = List.of(
      "button[aria-label='Done'], button[aria-label='Dismiss']",
      "xpath=//button[.//span[normalize-space()='Done'] or normalize-space()='Done']");

  public static final List<String> CLOSE = List.of(
      "button[aria-label='Dismiss'], button[data-test-modal-close-btn], "
          + "button.artdeco-modal__dismiss",
      "xpath=//*[local-name()='svg' and @data-test-icon='close-medium']/ancestor::button[1]");

  public static final List<String> DISCARD = List.of(
      "button[data-control-name='discard_application_confirm_btn'], "
          + "button[data-test-dialog-secondary-btn]",
      "xpath=//button[.//span[normalize-space()='Discard'] or normalize-space()='Discard']");

  public static final String CLOSE_SCRIPT = "const b = document.querySelector("
      + "'button[aria-label=\"Dismiss\"], button[data-test-modal-close-btn], "
      + "button.artdeco-modal__dismiss'); if (b) { b.click(); return true; } return false;";

  public static final String DISCARD_SCRIPT = "const b = document.querySelector("
      + "'button[data-control-name=\"discard_application_confirm_btn\"], "
      + "button[data-test-dialog-secondary-btn]') "
      + "|| Array.from(document.querySelectorAll('button'))"
      + ".find(x => x.innerText.trim() === 'Discard'); if (b) { b.click(); return true; } "
      + "return false;";

  public static final List<String> CONTINUE_KEYWORDS =
      List.of("next", "continue", "proceed", "review");

  public static final List<String> ALTERNATE_KEYWORDS =
      List.of("next", "continue", "submit", "review");

  /**
   * Continue controls in priority order
   */
  public static final List<ControlCandidate> CONTINUE_CANDIDATES = List.of(
      ControlCandidate.of("next-marker", "[data-easy-apply-next-button]",
          "[data-easy-apply-next-button]"),
      ControlCandidate.of("footer-next",
          "xpath=.//footer//button[.//span[normalize-space()='Next'] or normalize-space()='Next']",
          "xpath=//footer//button[.//span[normalize-space()='Next'] or normalize-space()='Next']"),
      ControlCandidate.of("continue-aria", "button[aria-label='Continue to next step']",
          "button[aria-label='Continue to next step']"),
      ControlCandidate.of("review-aria", "button[aria-label='Review your application']",
          "button[aria-label='Review your application']"),
      ControlCandidate.of("review-text",
          "xpath=.//button[.//span[normalize-space()='Review'] or normalize-space()='Review']",
          "xpath=//button[.//span[normalize-space()='Review'] or normalize-space()='Review']"),
      ControlCandidate.of("next-text", "xpath=.//button[contains(normalize-space(.), 'Next')]",
          "xpath=//button[contains(normalize-space(.), 'Next')]"),
      new ControlCandidate("styled-button",
          "button.artdeco-button--primary, button.artdeco-button--secondary", null,
          CONTINUE_KEYWORDS));

  private WizardSelectors() {}
}

package com.autoapply.tool.easyapply.wizard.impl;

import java.util.List;
import org.springframework.stereotype.Service;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.browser.ElementSet;
import com.autoapply.tool.easyapply.browser.UiDriver;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import com.autoapply.tool.easyapply.wizard.EmergencyExitService;
import com.autoapply.tool.easyapply.wizard.WizardSelectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Close, then discard, then verify. Each step tries a composite selector, an icon or attribute
 * selector and finally a DOM query script.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmergencyExitServiceImpl implements EmergencyExitService {

  private final UiDriver uiDriver;
  private final EasyApplyProperties properties;

  @Override
  public boolean close() {
    try {
      if (!modalPresent()) {
        log.debug("Application form already closed");
        return true;
      }
      log.info("Closing application form");
      long wait = properties.getWizard().getCloseWait().toMillis();

      if (!clickFirst(WizardSelectors.CLOSE, WizardSelectors.CLOSE_SCRIPT, "close")) {
        log.warn("No close control found");
      }
      uiDriver.waitForTimeout(wait);

      if (clickFirst(WizardSelectors.DISCARD, WizardSelectors.DISCARD_SCRIPT, "discard")) {
        uiDriver.waitForTimeout(wait);
      }

      boolean closed = !modalPresent();
      if (closed) {
        log.info("Application form closed");
      } else {
        log.warn("Application form still open after emergency exit");
      }
      return closed;
    } catch (RuntimeException e) {
      log.error("Emergency exit failed: {}", e.getMessage());
      return false;
    }
  }

  private boolean modalPresent() {
    return !uiDriver.locate(WizardSelectors.MODAL).visible().isEmpty();
  }

  private boolean clickFirst(List<String> selectors, String script, String description) {
    for (String selector : selectors) {
      try {
        ElementSet found = uiDriver.locate(selector).visible();
        if (found.isEmpty()) {
          continue;
        }
        found.first().click(properties.getWizard().getClickTimeout());
        log.debug("Clicked {} control via {}", description, selector);
        return true;
      } catch (UiInteractionException e) {
        log.debug("{} via {} failed: {}", description, selector, e.getMessage());
      }
    }
    try {
      if (Boolean.TRUE.equals(uiDriver.evaluate(script))) {
        log.debug("Clicked {} control via script", description);
        return true;
      }
    } catch (UiInteractionException e) {
      log.debug("{} via script failed: {}", description, e.getMessage());
    }
    return false;
  }
}

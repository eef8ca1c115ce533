package com.autoapply.tool.easyapply.wizard;

import java.time.Duration;
import org.springframework.stereotype.Component;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.browser.Selectors;
import com.autoapply.tool.easyapply.browser.UiDriver;
import com.autoapply.tool.easyapply.browser.UiElement;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Clicks a control with escalating strategies: native click with a short timeout, a script click
 * on the element, then a script click on the first page element matching a selector.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ControlClicker {

  static final String CSS_CLICK_SCRIPT = "const el = document.querySelector(arguments[0]); "
      + "if (el) { el.click(); return true; } return false;";
  static final String XPATH_CLICK_SCRIPT = "const el = document.evaluate(arguments[0], document, "
      + "null, XPathResult.FIRST_ORDERED_NODE_TYPE, null).singleNodeValue; "
      + "if (el) { el.click(); return true; } return false;";

  private final UiDriver uiDriver;
  private final EasyApplyProperties properties;

  /**
   * @param control the control to click
   * @param pageSelector page-wide selector for the last strategy, or null to skip it
   * @param description used in logs
   * @return true when one strategy went through
   */
  public boolean click(UiElement control, String pageSelector, String description) {
    Duration timeout = properties.getWizard().getClickTimeout();
    try {
      control.click(timeout);
      log.debug("Clicked {} directly", description);
      return true;
    } catch (UiInteractionException e) {
      log.debug("Direct click on {} failed: {}", description, e.getMessage());
    }

    try {
      control.scriptClick();
      log.debug("Clicked {} by script", description);
      return true;
    } catch (UiInteractionException e) {
      log.debug("Script click on {} failed: {}", description, e.getMessage());
    }

    if (pageSelector == null) {
      log.warn("Could not click {}", description);
      return false;
    }
    try {
      Object clicked = uiDriver.evaluate(scriptFor(pageSelector), expression(pageSelector));
      if (Boolean.TRUE.equals(clicked)) {
        log.debug("Clicked {} through page query", description);
        return true;
      }
    } catch (UiInteractionException e) {
      log.debug("Page query click on {} failed: {}", description, e.getMessage());
    }
    log.warn("All click strategies failed for {}", description);
    return false;
  }

  static String scriptFor(String selector) {
    return Selectors.isXPath(selector) ? XPATH_CLICK_SCRIPT : CSS_CLICK_SCRIPT;
  }

  static String expression(String selector) {
    String s = selector.trim();
    return s.startsWith(Selectors.XPATH_PREFIX) ? s.substring(Selectors.XPATH_PREFIX.length()) : s;
  }
}

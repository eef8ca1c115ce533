package com.autoapply.tool.easyapply.wizard;

import java.util.Locale;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.config.EasyApplyConfig.WizardProperties;
import com.autoapply.tool.easyapply.browser.UiDriver;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Detects an entry control that led away from the application form, either to an external
 * application site or to a blocked page on the job board, and returns to the job page.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedirectGuard {

  private final UiDriver uiDriver;
  private final EasyApplyProperties properties;

  /**
   * @return the failure reason when the page was redirected
   */
  public Optional<String> checkAndReturn() {
    WizardProperties wizard = properties.getWizard();
    String url = uiDriver.currentUrl();
    if (url == null) {
      return Optional.empty();
    }

    String lower = url.toLowerCase(Locale.ROOT);
    for (String pattern : wizard.getBlockedUrlPatterns()) {
      if (StringUtils.isNotBlank(pattern) && lower.contains(pattern.toLowerCase(Locale.ROOT))) {
        log.warn("Redirected to blocked page {} (matches '{}'), going back", url, pattern);
        goBack(url);
        return Optional.of("Redirected to blocked page: " + url);
      }
    }

    String allowed = wizard.getAllowedUrlFragment();
    if (StringUtils.isBlank(allowed) || url.contains(allowed)) {
      return Optional.empty();
    }
    log.warn("Redirected to external application {}, going back", url);
    goBack(url);
    return Optional.of("Redirected to external application: " + url);
  }

  private void goBack(String url) {
    try {
      uiDriver.navigateBack();
    } catch (UiInteractionException e) {
      log.warn("Could not navigate back from {}: {}", url, e.getMessage());
    }
  }
}

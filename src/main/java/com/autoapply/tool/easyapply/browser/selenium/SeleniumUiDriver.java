package com.autoapply.tool.easyapply.browser.selenium;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import com.autoapply.tool.easyapply.browser.ElementSet;
import com.autoapply.tool.easyapply.browser.Selectors;
import com.autoapply.tool.easyapply.browser.UiDriver;
import com.autoapply.tool.easyapply.browser.UiElement;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link UiDriver} over a Selenium {@link WebDriver}. Selenium failures are translated to
 * {@link UiInteractionException} at this boundary.
 */
@Slf4j
public class SeleniumUiDriver implements UiDriver {

  private final WebDriver driver;
  private final Duration defaultClickTimeout;

  public SeleniumUiDriver(WebDriver driver, Duration defaultClickTimeout) {
    this.driver = driver;
    this.defaultClickTimeout = defaultClickTimeout;
  }

  @Override
  public ElementSet locate(String selector) {
    try {
      List<WebElement> found = driver.findElements(Selectors.toBy(selector));
      return wrap(found);
    } catch (WebDriverException e) {
      throw new UiInteractionException("Locate failed for '" + selector + "': " + e.getMessage(),
          e);
    }
  }

  @Override
  public Object evaluate(String script, Object... args) {
    try {
      return ((JavascriptExecutor) driver).executeScript(script, args);
    } catch (WebDriverException e) {
      throw new UiInteractionException("Script evaluation failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void waitForTimeout(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting {}ms", millis);
    }
  }

  @Override
  public String currentUrl() {
    try {
      return driver.getCurrentUrl();
    } catch (WebDriverException e) {
      throw new UiInteractionException("Could not read current URL: " + e.getMessage(), e);
    }
  }

  @Override
  public void navigateTo(String url) {
    try {
      driver.get(url);
    } catch (WebDriverException e) {
      throw new UiInteractionException("Navigation to " + url + " failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void navigateBack() {
    try {
      driver.navigate().back();
    } catch (WebDriverException e) {
      throw new UiInteractionException("Navigation back failed: " + e.getMessage(), e);
    }
  }

  public WebDriver getWebDriver() {
    return driver;
  }

  ElementSet wrap(List<WebElement> found) {
    List<UiElement> elements = new ArrayList<>(found.size());
    for (WebElement element : found) {
      elements.add(new SeleniumUiElement(this, element, defaultClickTimeout));
    }
    return ElementSet.of(elements);
  }
}

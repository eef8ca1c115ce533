package com.autoapply.tool.easyapply.browser.selenium;

import java.time.Duration;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.Select;
import org.openqa.selenium.support.ui.WebDriverWait;
import com.autoapply.tool.easyapply.browser.ElementSet;
import com.autoapply.tool.easyapply.browser.Selectors;
import com.autoapply.tool.easyapply.browser.UiElement;
import com.autoapply.tool.easyapply.browser.UiInteractionException;

class SeleniumUiElement implements UiElement {

  private final SeleniumUiDriver owner;
  private final WebElement element;
  private final Duration defaultTimeout;

  SeleniumUiElement(SeleniumUiDriver owner, WebElement element, Duration defaultTimeout) {
    this.owner = owner;
    this.element = element;
    this.defaultTimeout = defaultTimeout;
  }

  @Override
  public ElementSet locate(String selector) {
    try {
      return owner.wrap(element.findElements(Selectors.toBy(selector)));
    } catch (WebDriverException e) {
      throw new UiInteractionException(
          "Scoped locate failed for '" + selector + "': " + e.getMessage(), e);
    }
  }

  @Override
  public void click(Duration timeout) {
    Duration effective = timeout != null ? timeout : defaultTimeout;
    try {
      WebDriverWait wait = new WebDriverWait(owner.getWebDriver(), effective);
      wait.until(ExpectedConditions.elementToBeClickable(element)).click();
    } catch (WebDriverException e) {
      throw new UiInteractionException("Click failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void scriptClick() {
    try {
      ((JavascriptExecutor) owner.getWebDriver()).executeScript("arguments[0].click();", element);
    } catch (WebDriverException e) {
      throw new UiInteractionException("Script click failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void fill(String text) {
    try {
      element.clear();
      element.sendKeys(text == null ? "" : text);
    } catch (WebDriverException e) {
      throw new UiInteractionException("Fill failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void selectOption(String label) {
    try {
      new Select(element).selectByVisibleText(label);
    } catch (WebDriverException e) {
      throw new UiInteractionException("Select '" + label + "' failed: " + e.getMessage(), e);
    }
  }

  @Override
  public String getAttribute(String name) {
    try {
      return element.getAttribute(name);
    } catch (WebDriverException e) {
      throw new UiInteractionException("Reading attribute " + name + " failed: " + e.getMessage(),
          e);
    }
  }

  @Override
  public String innerText() {
    try {
      String text = element.getText();
      return text == null ? "" : text;
    } catch (WebDriverException e) {
      throw new UiInteractionException("Reading text failed: " + e.getMessage(), e);
    }
  }

  @Override
  public String innerHtml() {
    try {
      String html = element.getDomProperty("innerHTML");
      return html == null ? "" : html;
    } catch (WebDriverException e) {
      throw new UiInteractionException("Reading innerHTML failed: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean isVisible() {
    try {
      return element.isDisplayed();
    } catch (WebDriverException e) {
      throw new UiInteractionException("Visibility check failed: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean isChecked() {
    try {
      return element.isSelected() || "true".equals(element.getAttribute("aria-checked"));
    } catch (WebDriverException e) {
      throw new UiInteractionException("Checked-state read failed: " + e.getMessage(), e);
    }
  }
}

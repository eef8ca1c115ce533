package com.autoapply.tool.easyapply.wizard;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.browser.fake.FakeElement;
import com.autoapply.tool.easyapply.browser.fake.FakeUiDriver;

class ControlClickerTest {

  private FakeUiDriver driver;
  private ControlClicker clicker;

  @BeforeEach
  void setUp() {
    driver = new FakeUiDriver();
    clicker = new ControlClicker(driver, new EasyApplyProperties());
  }

  @Test
  void directClickWins() {
    FakeElement button = FakeElement.button("Next");

    assertThat(clicker.click(button, "button.next", "next")).isTrue();

    assertThat(button.getClickCount()).isEqualTo(1);
    assertThat(button.getScriptClickCount()).isZero();
    assertThat(driver.getScripts()).isEmpty();
  }

  @Test
  void escalatesToElementScriptClick() {
    FakeElement button = FakeElement.button("Next").failingDirectClick();

    assertThat(clicker.click(button, "button.next", "next")).isTrue();

    assertThat(button.getScriptClickCount()).isEqualTo(1);
    assertThat(driver.getScripts()).isEmpty();
  }

  @Test
  void escalatesToPageQuery() {
    FakeElement button = FakeElement.button("Next").failingClicks();
    driver.scriptResult(Boolean.TRUE);

    assertThat(clicker.click(button, "button.next", "next")).isTrue();

    assertThat(driver.getScripts()).containsExactly(ControlClicker.CSS_CLICK_SCRIPT);
  }

  @Test
  void xpathSelectorsUseDocumentEvaluate() {
    FakeElement button = FakeElement.button("Next").failingClicks();
    driver.scriptResult(Boolean.TRUE);

    assertThat(clicker.click(button, "xpath=//footer//button", "next")).isTrue();

    assertThat(driver.getScripts()).containsExactly(ControlClicker.XPATH_CLICK_SCRIPT);
    assertThat(ControlClicker.expression("xpath=//footer//button")).isEqualTo("//footer//button");
  }

  @Test
  void failsWhenEveryStrategyFails() {
    FakeElement button = FakeElement.button("Next").failingClicks();

    assertThat(clicker.click(button, "button.next", "next")).isFalse();
    assertThat(clicker.click(button, null, "next")).isFalse();
    assertThat(driver.getScripts()).hasSize(1);
  }
}

package com.autoapply.tool.easyapply.browser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;

class SelectorsTest {

  @Test
  void prefixedAndPathSelectorsAreXPath() {
    assertThat(Selectors.toBy("xpath=ancestor::fieldset[1]"))
        .isEqualTo(By.xpath("ancestor::fieldset[1]"));
    assertThat(Selectors.toBy("//footer//button")).isEqualTo(By.xpath("//footer//button"));
    assertThat(Selectors.toBy("./..")).isEqualTo(By.xpath("./.."));
  }

  @Test
  void everythingElseIsCss() {
    assertThat(Selectors.toBy("button[aria-label='Submit application']"))
        .isEqualTo(By.cssSelector("button[aria-label='Submit application']"));
    assertThat(Selectors.isXPath("div.jobs-easy-apply-content")).isFalse();
  }

  @Test
  void blankSelectorIsRejected() {
    assertThatThrownBy(() -> Selectors.toBy(" ")).isInstanceOf(IllegalArgumentException.class);
  }
}

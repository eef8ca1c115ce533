package com.autoapply.tool.easyapply.wizard;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.browser.fake.FakeUiDriver;

class RedirectGuardTest {

  private FakeUiDriver driver;
  private EasyApplyProperties properties;
  private RedirectGuard guard;

  @BeforeEach
  void setUp() {
    driver = new FakeUiDriver();
    properties = new EasyApplyProperties();
    guard = new RedirectGuard(driver, properties);
  }

  @Test
  void staysOnJobBoard() {
    driver.currentUrl("https://www.linkedin.com/jobs/view/4021/");

    assertThat(guard.checkAndReturn()).isEmpty();
    assertThat(driver.getBackCount()).isZero();
  }

  @Test
  void premiumPageOnJobBoardHostIsBlocked() {
    String upsell = "https://www.linkedin.com/premium/products/?upsellOrderOrigin=apply";
    driver.currentUrl(upsell);

    assertThat(guard.checkAndReturn()).contains("Redirected to blocked page: " + upsell);
    assertThat(driver.getBackCount()).isEqualTo(1);
  }

  @Test
  void externalSiteNavigatesBack() {
    driver.currentUrl("https://jobs.example.org/apply?ref=li");

    assertThat(guard.checkAndReturn())
        .contains("Redirected to external application: https://jobs.example.org/apply?ref=li");
    assertThat(driver.getBackCount()).isEqualTo(1);
  }

  @Test
  void blockedPatternsApplyWithoutAllowedFragment() {
    properties.getWizard().setAllowedUrlFragment("");
    properties.getWizard().setBlockedUrlPatterns(List.of("/checkout"));

    driver.currentUrl("https://jobs.example.org/apply");
    assertThat(guard.checkAndReturn()).isEmpty();

    driver.currentUrl("https://shop.example.org/CHECKOUT/cart");
    assertThat(guard.checkAndReturn()).isPresent();
    assertThat(driver.getBackCount()).isEqualTo(1);
  }
}

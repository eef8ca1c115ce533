package com.autoapply.config;

import java.util.HashMap;
import java.util.Map;
import org.openqa.selenium.PageLoadStrategy;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import com.autoapply.config.EasyApplyConfig.BrowserProperties;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.browser.UiDriver;
import com.autoapply.tool.easyapply.browser.selenium.SeleniumUiDriver;
import lombok.extern.slf4j.Slf4j;

/**
 * Chrome session shared by the wizard and the session persistence. Created on first use.
 */
@Slf4j
@Configuration
public class BrowserConfig {

  @Bean(destroyMethod = "quit")
  public WebDriver webDriver(EasyApplyProperties properties) {
    BrowserProperties browser = properties.getBrowser();
    ChromeOptions options = new ChromeOptions();

    // Essential Chrome options for stability
    options.addArguments("--remote-allow-origins=*");
    options.addArguments("--no-sandbox");
    options.addArguments("--disable-dev-shm-usage");
    options.addArguments("--window-size=1920,1080");

    // Options to prevent detection and popups interfering with the form
    options.addArguments("--disable-blink-features=AutomationControlled");
    options.addArguments("--disable-infobars");
    options.addArguments("--disable-notifications");
    options.addArguments("--disable-save-password-bubble");
    options.addArguments("--disable-translate");
    options.addArguments("--no-first-run");
    options.addArguments("--no-default-browser-check");

    options.setPageLoadStrategy(PageLoadStrategy.EAGER);

    Map<String, Object> prefs = new HashMap<>();
    prefs.put("credentials_enable_service", false);
    prefs.put("profile.password_manager_enabled", false);
    options.setExperimentalOption("prefs", prefs);

    if (browser.isHeadless()) {
      options.addArguments("--headless=new");
      log.info("Running Chrome in headless mode");
    }

    ChromeDriver driver = new ChromeDriver(options);
    driver.manage().timeouts().pageLoadTimeout(browser.getPageLoadTimeout());
    log.info("Chrome started");
    return driver;
  }

  @Bean
  public UiDriver uiDriver(WebDriver webDriver, EasyApplyProperties properties) {
    return new SeleniumUiDriver(webDriver, properties.getWizard().getClickTimeout());
  }
}

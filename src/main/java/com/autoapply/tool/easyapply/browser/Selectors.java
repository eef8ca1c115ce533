package com.autoapply.tool.easyapply.browser;

import org.openqa.selenium.By;

/**
 * Selector syntax shared by the driver implementations.
 */
public final class Selectors {

  public static final String XPATH_PREFIX = "xpath=";

  private Selectors() {}

  public static boolean isXPath(String selector) {
    String s = selector.trim();
    return s.startsWith(XPATH_PREFIX) || s.startsWith("/") || s.startsWith("./")
        || s.startsWith("(");
  }

  public static By toBy(String selector) {
    if (selector == null || selector.isBlank()) {
      throw new IllegalArgumentException("Selector must not be blank");
    }
    String s = selector.trim();
    if (s.startsWith(XPATH_PREFIX)) {
      return By.xpath(s.substring(XPATH_PREFIX.length()));
    }
    if (isXPath(s)) {
      return By.xpath(s);
    }
    return By.cssSelector(s);
  }
}

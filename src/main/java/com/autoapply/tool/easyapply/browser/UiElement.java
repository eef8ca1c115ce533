package com.autoapply.tool.easyapply.browser;

import java.time.Duration;

/**
 * Handle to one element of the live document. Handles are ephemeral and are rebuilt on every
 * form step.
 */
public interface UiElement {

  /**
   * Locate descendants of this element. XPath selectors should be relative ({@code ./} or
   * {@code .//}).
   */
  ElementSet locate(String selector);

  /**
   * Native click, waiting at most {@code timeout} for the element to become clickable
   */
  void click(Duration timeout);

  /**
   * Click dispatched from a script on the element itself
   */
  void scriptClick();

  void fill(String text);

  /**
   * Select the option of a {@code select} element whose visible text equals {@code label}
   */
  void selectOption(String label);

  String getAttribute(String name);

  String innerText();

  String innerHtml();

  boolean isVisible();

  boolean isChecked();
}

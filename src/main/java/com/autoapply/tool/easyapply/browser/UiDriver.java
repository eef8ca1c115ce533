package com.autoapply.tool.easyapply.browser;

/**
 * Page-level primitives of the UI automation agent. Every call blocks until it completes or its
 * timeout expires, and may raise {@link UiInteractionException}.
 *
 * <p>
 * Selectors are CSS unless they are prefixed with {@code xpath=} or start with {@code /},
 * {@code ./} or {@code (}, in which case they are XPath expressions.
 * </p>
 */
public interface UiDriver {

  /**
   * Locate all elements of the current document matching the selector
   *
   * @param selector CSS or XPath selector
   * @return matching elements, possibly empty
   */
  ElementSet locate(String selector);

  /**
   * Run a script in the page
   *
   * @param script JavaScript body, arguments available as {@code arguments[i]}
   * @param args script arguments
   * @return the script result
   */
  Object evaluate(String script, Object... args);

  /**
   * Block the calling flow for a fixed time
   *
   * @param millis time to wait
   */
  void waitForTimeout(long millis);

  String currentUrl();

  void navigateTo(String url);

  void navigateBack();
}

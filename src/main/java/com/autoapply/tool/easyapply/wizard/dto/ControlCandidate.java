package com.autoapply.tool.easyapply.wizard.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A way of finding a control that moves the form forward. Candidates with keywords only accept
 * controls whose text contains one of them, and take the last such control.
 */
@Getter
@AllArgsConstructor
public class ControlCandidate {
  private final String name;

  /**
   * Selector relative to the form container
   */
  private final String selector;

  /**
   * Equivalent selector for the whole page, used by the scripted fallback click
   */
  private final String pageSelector;

  private final List<String> keywords;

  public static ControlCandidate of(String name, String selector, String pageSelector) {
    return new ControlCandidate(name, selector, pageSelector, List.of());
  }

  public boolean isKeywordFiltered() {
    return !keywords.isEmpty();
  }
}

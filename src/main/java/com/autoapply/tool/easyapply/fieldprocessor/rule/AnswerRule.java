package com.autoapply.tool.easyapply.fieldprocessor.rule;

import java.util.List;
import java.util.Optional;
import com.autoapply.common.util.LabelUtils;
import com.autoapply.tool.easyapply.fieldprocessor.enums.RuleScope;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A keyword set and what to do when a question label contains one of the keywords.
 */
@Value
@Builder
public class AnswerRule {
  String name;

  @Singular
  List<String> keywords;

  RuleScope scope;

  /**
   * Answer applied without asking the oracle; for critical rules only when the oracle gives none
   */
  String defaultAnswer;

  /**
   * Stored answers are never reused for matching labels
   */
  boolean critical;

  /**
   * Option substrings tried in order; the first option containing one is the answer. A rule with
   * hints does not apply when no option contains any of them.
   */
  @Singular
  List<String> optionHints;

  public boolean matches(String label) {
    return LabelUtils.containsAny(label, keywords);
  }

  public boolean hasDefault() {
    return defaultAnswer != null && !defaultAnswer.isBlank();
  }

  public Optional<String> pickOption(List<String> options) {
    if (options == null) {
      return Optional.empty();
    }
    for (String hint : optionHints) {
      for (String option : options) {
        if (LabelUtils.containsAny(option, List.of(hint))) {
          return Optional.of(option);
        }
      }
    }
    return Optional.empty();
  }
}

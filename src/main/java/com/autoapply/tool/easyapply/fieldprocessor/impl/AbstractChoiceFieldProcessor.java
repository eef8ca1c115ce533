package com.autoapply.tool.easyapply.fieldprocessor.impl;

import java.util.List;
import java.util.Optional;
import com.autoapply.tool.easyapply.answer.AnswerStore;
import com.autoapply.tool.easyapply.fieldprocessor.FieldProcessor;
import com.autoapply.tool.easyapply.fieldprocessor.OptionMatcher;
import com.autoapply.tool.easyapply.fieldprocessor.dto.FieldDescriptor;
import com.autoapply.tool.easyapply.fieldprocessor.rule.AnswerRule;
import com.autoapply.tool.easyapply.fieldprocessor.rule.AnswerRuleTable;
import com.autoapply.tool.easyapply.oracle.AnswerOracle;
import com.autoapply.tool.easyapply.oracle.OracleAnswer;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Option resolution shared by select and radio fields.
 *
 * <p>
 * Order: stored answer, rule default, oracle. Critical labels skip the first two and fall back to
 * the rule's forced default when the oracle gives nothing usable. Only oracle answers are
 * persisted, as the option text.
 */
@Slf4j
public abstract class AbstractChoiceFieldProcessor implements FieldProcessor {

  @Value
  static class Choice {
    int index;
    boolean persist;
  }

  protected final AnswerRuleTable ruleTable;
  protected final AnswerOracle answerOracle;

  protected AbstractChoiceFieldProcessor(AnswerRuleTable ruleTable, AnswerOracle answerOracle) {
    this.ruleTable = ruleTable;
    this.answerOracle = answerOracle;
  }

  @Override
  public boolean process(FieldDescriptor field, AnswerStore answerStore) {
    String label = field.getLabel();
    List<String> options = field.getOptions();
    if (options == null || options.isEmpty()) {
      log.warn("No options found for {} '{}'", supportedKind().getValue(), label);
      return false;
    }

    Optional<Choice> choice = resolve(field, answerStore);
    if (choice.isEmpty()) {
      log.warn("Could not resolve an option for '{}' among {}", label, options);
      return false;
    }

    int index = choice.get().getIndex();
    String option = options.get(index);
    if (!apply(field, index)) {
      return false;
    }
    log.info("Selected '{}' for '{}'", option, label);
    if (choice.get().isPersist()) {
      answerStore.set(label, option);
    }
    return true;
  }

  Optional<Choice> resolve(FieldDescriptor field, AnswerStore answerStore) {
    String label = field.getLabel();
    List<String> options = field.getOptions();
    Optional<AnswerRule> critical = ruleTable.findCritical(label);

    if (critical.isPresent()) {
      log.info("Critical question '{}' ({}), stored answers are not reused", label,
          critical.get().getName());
    } else {
      Optional<Integer> stored =
          answerStore.get(label).flatMap(answer -> OptionMatcher.matchExact(answer, options));
      if (stored.isPresent()) {
        return Optional.of(new Choice(stored.get(), false));
      }
      Optional<Integer> ruleDefault = ruleTable.choiceDefault(label, options)
          .flatMap(answer -> OptionMatcher.matchExact(answer, options));
      if (ruleDefault.isPresent()) {
        return Optional.of(new Choice(ruleDefault.get(), false));
      }
    }

    OracleAnswer answer =
        answerOracle.resolve(label, supportedKind(), options, field.getJobContext());
    if (answer.isResolved()) {
      Optional<Integer> matched = OptionMatcher.match(answer.getValue().orElseThrow(), options);
      if (matched.isPresent()) {
        return Optional.of(new Choice(matched.get(), true));
      }
      log.warn("Oracle answer '{}' matches no option of '{}'", answer.getValue().orElse(""),
          label);
    }

    if (critical.isPresent() && critical.get().hasDefault()) {
      Optional<Integer> forced =
          OptionMatcher.matchExact(critical.get().getDefaultAnswer(), options);
      if (forced.isPresent()) {
        log.info("Applying forced default '{}' to critical question '{}'",
            critical.get().getDefaultAnswer(), label);
        return Optional.of(new Choice(forced.get(), false));
      }
    }
    return Optional.empty();
  }

  /**
   * Put the option at {@code index} into effect on the page
   */
  protected abstract boolean apply(FieldDescriptor field, int index);
}

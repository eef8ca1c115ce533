package com.autoapply.tool.easyapply.fieldprocessor.rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;
import com.autoapply.common.util.LabelUtils;
import com.autoapply.config.EasyApplyConfig.DefaultAnswerProperties;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.fieldprocessor.enums.RuleScope;
import lombok.extern.slf4j.Slf4j;

/**
 * Ordered keyword rules shared by every field processor. The first matching rule of a scope wins,
 * so specific rules come before broad ones.
 */
@Slf4j
@Component
public class AnswerRuleTable {

  static final List<String> DECLINE_HINTS =
      List.of("prefer not", "decline", "do not wish", "don't wish", "not to answer");

  private final List<AnswerRule> rules;

  public AnswerRuleTable(EasyApplyProperties properties) {
    this(defaultRules(properties.getDefaults()));
  }

  public AnswerRuleTable(List<AnswerRule> rules) {
    this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    log.debug("Answer rule table loaded with {} rules", this.rules.size());
  }

  static List<AnswerRule> defaultRules(DefaultAnswerProperties defaults) {
    List<AnswerRule> rules = new ArrayList<>();

    // Legal-status questions, always re-resolved
    rules.add(AnswerRule.builder()
        .name("sponsorship")
        .keywords(List.of("visa", "sponsor", "work permit", "will you in the future require"))
        .scope(RuleScope.CHOICE)
        .defaultAnswer("No")
        .critical(true)
        .build());
    rules.add(AnswerRule.builder()
        .name("work-authorization")
        .keywords(List.of("legal", "legally", "authorization", "authorisation", "authorized",
            "authorised", "citizen", "right to work"))
        .scope(RuleScope.CHOICE)
        .critical(true)
        .build());

    // Free text defaults
    rules.add(AnswerRule.builder()
        .name("years-of-experience")
        .keywords(List.of("years of experience", "years of work experience", "how many years"))
        .scope(RuleScope.FREE_TEXT)
        .defaultAnswer(defaults.getYearsOfExperience())
        .build());
    rules.add(AnswerRule.builder()
        .name("notice-period")
        .keywords(List.of("notice period", "notice"))
        .scope(RuleScope.FREE_TEXT)
        .defaultAnswer(defaults.getNoticePeriod())
        .build());
    rules.add(AnswerRule.builder()
        .name("salary")
        .keywords(List.of("salary", "compensation", "expected pay", "desired pay"))
        .scope(RuleScope.FREE_TEXT)
        .defaultAnswer(defaults.getSalary())
        .build());

    // Voluntary self-identification
    rules.add(AnswerRule.builder()
        .name("gender")
        .keywords(List.of("gender", "sex"))
        .scope(RuleScope.CHOICE)
        .optionHints(DECLINE_HINTS)
        .build());
    rules.add(AnswerRule.builder()
        .name("ethnicity")
        .keywords(List.of("ethnicity", "ethnic", "race", "racial"))
        .scope(RuleScope.CHOICE)
        .optionHints(DECLINE_HINTS)
        .build());
    rules.add(AnswerRule.builder()
        .name("veteran")
        .keywords(List.of("veteran", "military"))
        .scope(RuleScope.YES_NO)
        .defaultAnswer("No")
        .build());

    // Yes/No defaults
    rules.add(AnswerRule.builder()
        .name("disability")
        .keywords(List.of("disability", "disabled"))
        .scope(RuleScope.YES_NO)
        .defaultAnswer("No")
        .build());
    rules.add(AnswerRule.builder()
        .name("remote")
        .keywords(List.of("remote", "work from home", "home working", "telecommut", "wfh"))
        .scope(RuleScope.YES_NO)
        .defaultAnswer("Yes")
        .build());
    rules.add(AnswerRule.builder()
        .name("commute")
        .keywords(List.of("commut", "relocat", "locat", "travel", "on-site", "move"))
        .scope(RuleScope.YES_NO)
        .defaultAnswer("Yes")
        .build());
    rules.add(AnswerRule.builder()
        .name("experience")
        .keywords(List.of("experience", "skill", "qualified", "eligible"))
        .scope(RuleScope.YES_NO)
        .defaultAnswer("Yes")
        .build());
    rules.add(AnswerRule.builder()
        .name("education")
        .keywords(List.of("degree", "education", "bachelor", "master"))
        .scope(RuleScope.YES_NO)
        .defaultAnswer("Yes")
        .build());
    return rules;
  }

  public Optional<AnswerRule> findCritical(String label) {
    return rules.stream().filter(AnswerRule::isCritical).filter(rule -> rule.matches(label))
        .findFirst();
  }

  public boolean isCritical(String label) {
    return findCritical(label).isPresent();
  }

  /**
   * Default for a free-text question, if a rule covers it
   */
  public Optional<String> textDefault(String label) {
    return rules.stream()
        .filter(rule -> rule.getScope() == RuleScope.FREE_TEXT)
        .filter(AnswerRule::hasDefault)
        .filter(rule -> rule.matches(label))
        .findFirst()
        .map(AnswerRule::getDefaultAnswer);
  }

  /**
   * Default for a non-critical choice question. Yes/No rules only apply when the options offer
   * both answers; rules with option hints only when an option contains one of them.
   */
  public Optional<String> choiceDefault(String label, List<String> options) {
    boolean yesNo = offersYesAndNo(options);
    for (AnswerRule rule : rules) {
      if (rule.isCritical() || !rule.matches(label)) {
        continue;
      }
      Optional<String> answer = Optional.empty();
      if (!rule.getOptionHints().isEmpty()) {
        answer = rule.pickOption(options);
      } else if (rule.hasDefault() && (rule.getScope() == RuleScope.CHOICE
          || (rule.getScope() == RuleScope.YES_NO && yesNo))) {
        answer = Optional.of(rule.getDefaultAnswer());
      }
      if (answer.isPresent()) {
        log.info("Rule '{}' answers '{}' with '{}'", rule.getName(), label, answer.get());
        return answer;
      }
    }
    return Optional.empty();
  }

  static boolean offersYesAndNo(List<String> options) {
    if (options == null) {
      return false;
    }
    boolean yes = options.stream().anyMatch(LabelUtils::isYes);
    boolean no = options.stream().anyMatch(LabelUtils::isNo);
    return yes && no;
  }

  public List<AnswerRule> getRules() {
    return rules;
  }
}

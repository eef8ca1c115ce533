package com.autoapply.tool.easyapply.fieldprocessor.rule;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.junit.jupiter.api.Test;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.fieldprocessor.enums.RuleScope;

class AnswerRuleTableTest {

  private static final List<String> YES_NO = List.of("Yes", "No");

  private final AnswerRuleTable table = new AnswerRuleTable(new EasyApplyProperties());

  @Test
  void legalStatusQuestionsAreCritical() {
    assertThat(table.findCritical("Will you now or in the future require sponsorship?"))
        .map(AnswerRule::getName).contains("sponsorship");
    assertThat(table.findCritical("Are you legally authorized to work in the United States?"))
        .map(AnswerRule::getName).contains("work-authorization");
    assertThat(table.isCritical("Do you hold a valid work permit?")).isTrue();
    assertThat(table.isCritical("Are you comfortable commuting to this job's location?"))
        .isFalse();
  }

  @Test
  void criticalRulesNeverSupplyAChoiceDefault() {
    assertThat(table.choiceDefault("Do you require visa sponsorship?", YES_NO)).isEmpty();
  }

  @Test
  void freeTextDefaultsComeFromConfiguration() {
    EasyApplyProperties properties = new EasyApplyProperties();
    properties.getDefaults().setYearsOfExperience("5");
    AnswerRuleTable configured = new AnswerRuleTable(properties);

    assertThat(configured.textDefault("How many years of experience do you have with Java?"))
        .contains("5");
    assertThat(table.textDefault("What is your notice period?")).contains("2 weeks");
    assertThat(table.textDefault("Expected salary (USD)")).contains("50000");
    assertThat(table.textDefault("Mobile phone number")).isEmpty();
  }

  @Test
  void yesNoDefaultsNeedBothAnswersOffered() {
    assertThat(table.choiceDefault("Do you have a disability?", YES_NO)).contains("No");
    assertThat(table.choiceDefault("Are you willing to relocate?", YES_NO)).contains("Yes");
    assertThat(table.choiceDefault("Do you have experience with Kafka?", YES_NO)).contains("Yes");
    assertThat(table.choiceDefault("Do you have experience with Kafka?",
        List.of("None", "Some", "A lot"))).isEmpty();
  }

  @Test
  void selfIdentificationQuestionsPickTheDeclineOption() {
    assertThat(table.choiceDefault("Gender",
        List.of("Male", "Female", "Non-binary", "I prefer not to say")))
        .contains("I prefer not to say");
    assertThat(table.choiceDefault("What is your race or ethnicity?",
        List.of("Asian", "Black or African American", "Hispanic or Latino",
            "I decline to self-identify")))
        .contains("I decline to self-identify");
  }

  @Test
  void selfIdentificationWithoutDeclineOptionIsLeftToTheOracle() {
    assertThat(table.choiceDefault("Ethnicity", List.of("Asian", "Hispanic or Latino", "White")))
        .isEmpty();
    assertThat(table.choiceDefault("Sex", List.of("Male", "Female"))).isEmpty();
  }

  @Test
  void veteranStatusDefaultsToNo() {
    assertThat(table.choiceDefault("Are you a protected veteran?", YES_NO)).contains("No");
    assertThat(table.choiceDefault("Have you served in the military?", YES_NO)).contains("No");
  }

  @Test
  void firstMatchingRuleWins() {
    // "disability" comes before the broad "experience" rule
    assertThat(table.choiceDefault("Do you have any experience living with a disability?", YES_NO))
        .contains("No");
  }

  @Test
  void customRulesReplaceTheDefaults() {
    AnswerRuleTable custom = new AnswerRuleTable(List.of(AnswerRule.builder()
        .name("clearance")
        .keyword("security clearance")
        .scope(RuleScope.CHOICE)
        .defaultAnswer("Secret")
        .build()));

    assertThat(custom.getRules()).hasSize(1);
    assertThat(custom.choiceDefault("Which security clearance do you hold?",
        List.of("None", "Secret", "Top Secret"))).contains("Secret");
    assertThat(custom.choiceDefault("Do you have a disability?", YES_NO)).isEmpty();
  }

  @Test
  void offersYesAndNoChecksBothAnswers() {
    assertThat(AnswerRuleTable.offersYesAndNo(YES_NO)).isTrue();
    assertThat(AnswerRuleTable.offersYesAndNo(List.of("Yes"))).isFalse();
    assertThat(AnswerRuleTable.offersYesAndNo(null)).isFalse();
  }
}

package com.autoapply.tool.easyapply.fieldprocessor.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.answer.AnswerStore;
import com.autoapply.tool.easyapply.browser.fake.FakeElement;
import com.autoapply.tool.easyapply.fieldprocessor.dto.FieldDescriptor;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.fieldprocessor.rule.AnswerRuleTable;
import com.autoapply.tool.easyapply.oracle.AnswerOracle;
import com.autoapply.tool.easyapply.oracle.OracleAnswer;

@ExtendWith(MockitoExtension.class)
class SelectFieldProcessorTest {

  @Mock
  private AnswerStore answerStore;

  @Mock
  private AnswerOracle answerOracle;

  private SelectFieldProcessor processor;

  @BeforeEach
  void setUp() {
    processor =
        new SelectFieldProcessor(new AnswerRuleTable(new EasyApplyProperties()), answerOracle);
  }

  private static FieldDescriptor select(String label, String... options) {
    FakeElement handle = FakeElement.of("select");
    FakeElement[] optionElements = new FakeElement[options.length];
    for (int i = 0; i < options.length; i++) {
      optionElements[i] = FakeElement.of("option").text(options[i]);
    }
    handle.with("option", optionElements);
    return FieldDescriptor.builder()
        .label(label)
        .kind(FieldKind.SELECT)
        .options(List.of(options))
        .handle(handle)
        .build();
  }

  private static String selected(FieldDescriptor field) {
    return ((FakeElement) field.getHandle()).getSelectedOption();
  }

  @Test
  void storedAnswerIsSelectedWithoutAskingTheOracle() {
    FieldDescriptor field = select("Preferred shift", "Day", "Night");
    when(answerStore.get("Preferred shift")).thenReturn(Optional.of("night"));

    assertThat(processor.process(field, answerStore)).isTrue();

    assertThat(selected(field)).isEqualTo("Night");
    verifyNoInteractions(answerOracle);
    verify(answerStore, never()).set(anyString(), anyString());
  }

  @Test
  void oracleAnswerIsStoredAsOptionText() {
    FieldDescriptor field = select("English proficiency", "Conversational", "Professional",
        "Native or bilingual");
    when(answerStore.get("English proficiency")).thenReturn(Optional.empty());
    when(answerOracle.resolve(eq("English proficiency"), eq(FieldKind.SELECT), any(), any()))
        .thenReturn(OracleAnswer.of("3"));

    assertThat(processor.process(field, answerStore)).isTrue();

    assertThat(selected(field)).isEqualTo("Native or bilingual");
    verify(answerStore).set("English proficiency", "Native or bilingual");
  }

  @Test
  void criticalQuestionIgnoresStoredAnswer() {
    FieldDescriptor field = select("Will you require visa sponsorship?", "Yes", "No");
    when(answerOracle.resolve(any(), any(), any(), any())).thenReturn(OracleAnswer.of("Yes"));

    assertThat(processor.process(field, answerStore)).isTrue();

    assertThat(selected(field)).isEqualTo("Yes");
    verify(answerStore, never()).get(anyString());
    verify(answerStore).set("Will you require visa sponsorship?", "Yes");
  }

  @Test
  void criticalQuestionFallsBackToForcedDefault() {
    FieldDescriptor field = select("Will you require visa sponsorship?", "Yes", "No");
    when(answerOracle.resolve(any(), any(), any(), any())).thenReturn(OracleAnswer.unresolved());

    assertThat(processor.process(field, answerStore)).isTrue();

    assertThat(selected(field)).isEqualTo("No");
    verify(answerStore, never()).set(anyString(), anyString());
  }

  @Test
  void criticalQuestionWithoutDefaultStaysUnanswered() {
    FieldDescriptor field = select("Are you legally authorized to work here?", "Yes", "No");
    when(answerOracle.resolve(any(), any(), any(), any())).thenReturn(OracleAnswer.unresolved());

    assertThat(processor.process(field, answerStore)).isFalse();

    assertThat(selected(field)).isNull();
  }

  @Test
  void ruleDefaultAppliesWithoutOracle() {
    FieldDescriptor field = select("Are you comfortable commuting to this job's location?",
        "Yes", "No");
    when(answerStore.get(anyString())).thenReturn(Optional.empty());

    assertThat(processor.process(field, answerStore)).isTrue();

    assertThat(selected(field)).isEqualTo("Yes");
    verifyNoInteractions(answerOracle);
    verify(answerStore, never()).set(anyString(), anyString());
  }

  @Test
  void unmatchedOracleAnswerFails() {
    FieldDescriptor field = select("Preferred shift", "Day", "Night");
    when(answerStore.get(anyString())).thenReturn(Optional.empty());
    when(answerOracle.resolve(any(), any(), any(), any()))
        .thenReturn(OracleAnswer.of("Whatever suits the team"));

    assertThat(processor.process(field, answerStore)).isFalse();

    assertThat(selected(field)).isNull();
    verify(answerStore, never()).set(anyString(), anyString());
  }

  @Test
  void fieldWithoutOptionsFails() {
    FieldDescriptor field = select("Preferred shift");

    assertThat(processor.process(field, answerStore)).isFalse();
    verifyNoInteractions(answerOracle, answerStore);
  }
}

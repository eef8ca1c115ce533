package com.autoapply.tool.easyapply.oracle.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.oracle.AnswerOracle;
import com.autoapply.tool.easyapply.oracle.OracleAnswer;

@ExtendWith(MockitoExtension.class)
class ChainedAnswerOracleTest {

  @Mock
  private AnswerOracle first;

  @Mock
  private AnswerOracle second;

  private ChainedAnswerOracle chain;

  @BeforeEach
  void setUp() {
    lenient().when(first.getName()).thenReturn("first");
    lenient().when(second.getName()).thenReturn("second");
    chain = new ChainedAnswerOracle(List.of(first, second));
  }

  @Test
  void firstResolvedAnswerWins() {
    when(first.resolve(any(), any(), any(), any())).thenReturn(OracleAnswer.of("Berlin"));

    OracleAnswer answer = chain.resolve("City", FieldKind.TEXT, List.of(), null);

    assertThat(answer.getValue()).contains("Berlin");
    verifyNoInteractions(second);
  }

  @Test
  void unresolvedFallsThroughToNextOracle() {
    when(first.resolve(any(), any(), any(), any())).thenReturn(OracleAnswer.unresolved());
    when(second.resolve(any(), any(), any(), any())).thenReturn(OracleAnswer.of("2"));

    OracleAnswer answer = chain.resolve("Shift", FieldKind.SELECT, List.of("Day", "Night"), null);

    assertThat(answer.getValue()).contains("2");
  }

  @Test
  void failingOracleIsSkipped() {
    when(first.resolve(any(), any(), any(), any())).thenThrow(new IllegalStateException("down"));
    when(second.resolve(any(), any(), any(), any())).thenReturn(OracleAnswer.of("Yes"));

    assertThat(chain.resolve("Remote?", FieldKind.RADIO, List.of("Yes", "No"), null).getValue())
        .contains("Yes");
  }

  @Test
  void nothingResolvedIsUnresolved() {
    when(first.resolve(any(), any(), any(), any())).thenReturn(OracleAnswer.unresolved());
    when(second.resolve(any(), any(), any(), any())).thenReturn(null);

    assertThat(chain.resolve("City", FieldKind.TEXT, List.of(), null).isResolved()).isFalse();
    assertThat(new ChainedAnswerOracle(List.of()).resolve("City", FieldKind.TEXT, List.of(), null))
        .isEqualTo(OracleAnswer.unresolved());
  }
}

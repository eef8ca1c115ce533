package com.autoapply.tool.easyapply.oracle.impl;

import static org.assertj.core.api.Assertions.assertThat;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.autoapply.tool.easyapply.oracle.OracleAnswer;

class ConsoleAnswerOracleTest {

  private final ByteArrayOutputStream output = new ByteArrayOutputStream();

  private ConsoleAnswerOracle oracle(String input) {
    return new ConsoleAnswerOracle(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
        new PrintStream(output, true, StandardCharsets.UTF_8));
  }

  @Test
  void readsOneLinePerQuestion() {
    ConsoleAnswerOracle oracle = oracle("Berlin\n2\n");
    JobContext job = JobContext.builder().title("Backend Engineer").company("Acme").build();

    OracleAnswer city = oracle.resolve("City", FieldKind.TEXT, List.of(), job);
    OracleAnswer shift = oracle.resolve("Shift", FieldKind.SELECT, List.of("Day", "Night"), job);

    assertThat(city.getValue()).contains("Berlin");
    assertThat(shift.getValue()).contains("2");
    String printed = output.toString(StandardCharsets.UTF_8);
    assertThat(printed).contains("[Backend Engineer at Acme]").contains("  2. Night");
  }

  @Test
  void blankOrClosedInputIsUnresolved() {
    ConsoleAnswerOracle oracle = oracle("   \n");

    assertThat(oracle.resolve("City", FieldKind.TEXT, List.of(), null).isResolved()).isFalse();
    assertThat(oracle.resolve("City", FieldKind.TEXT, List.of(), null).isResolved()).isFalse();
  }
}

package com.autoapply.tool.easyapply.oracle.impl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;
import com.autoapply.config.OracleConfig.OracleProperties;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.autoapply.tool.easyapply.oracle.OracleAnswer;
import com.autoapply.tool.easyapply.oracle.OracleQuotaExceededException;
import com.autoapply.tool.easyapply.oracle.client.GeminiClient;

@ExtendWith(MockitoExtension.class)
class GeminiAnswerOracleTest {

  @Mock
  private GeminiClient geminiClient;

  private OracleProperties properties;
  private GeminiAnswerOracle oracle;

  @BeforeEach
  void setUp() {
    properties = new OracleProperties();
    properties.setApplicantProfile("Java developer, 6 years, based in Berlin, EU citizen.");
    oracle = new GeminiAnswerOracle(geminiClient, properties);
  }

  @Test
  void unconfiguredClientIsNotCalled() {
    when(geminiClient.isConfigured()).thenReturn(false);

    assertThat(oracle.resolve("City", FieldKind.TEXT, List.of(), null).isResolved()).isFalse();
    verify(geminiClient, never()).generate(anyString());
  }

  @Test
  void numberedReplyIsReducedToTheNumber() {
    when(geminiClient.isConfigured()).thenReturn(true);
    when(geminiClient.generate(anyString())).thenReturn("2. No");

    OracleAnswer answer = oracle.resolve("Do you need sponsorship?", FieldKind.RADIO,
        List.of("Yes", "No"), null);

    assertThat(answer.getValue()).contains("2");
  }

  @Test
  void unknownReplyIsUnresolved() {
    when(geminiClient.isConfigured()).thenReturn(true);
    when(geminiClient.generate(anyString())).thenReturn("UNKNOWN.");

    assertThat(oracle.resolve("Favourite colour", FieldKind.TEXT, List.of(), null).isResolved())
        .isFalse();
  }

  @Test
  void clientFailuresAreUnresolved() {
    when(geminiClient.isConfigured()).thenReturn(true);
    when(geminiClient.generate(anyString()))
        .thenThrow(new OracleQuotaExceededException("quota", 429))
        .thenThrow(new ResourceAccessException("timeout"));

    assertThat(oracle.resolve("City", FieldKind.TEXT, List.of(), null).isResolved()).isFalse();
    assertThat(oracle.resolve("City", FieldKind.TEXT, List.of(), null).isResolved()).isFalse();
  }

  @Test
  void promptCarriesProfileJobAndNumberedOptions() {
    JobContext job = JobContext.builder().title("Backend Engineer").company("Acme")
        .location("Berlin").description("Build services").build();

    String prompt = oracle.buildPrompt("Preferred shift", FieldKind.SELECT,
        List.of("Day", "Night"), job);

    assertThat(prompt)
        .contains("Java developer, 6 years")
        .contains("Job: Backend Engineer at Acme")
        .contains("Location: Berlin")
        .contains("Question (select): Preferred shift")
        .contains("1. Day\n2. Night")
        .contains("number of the best option");
  }

  @Test
  void parseAnswerStripsQuotesAndTrailingPeriod() {
    assertThat(oracle.parseAnswer("\"Berlin.\"").getValue()).contains("Berlin");
    assertThat(oracle.parseAnswer("  3) Native or bilingual").getValue()).contains("3");
    assertThat(oracle.parseAnswer("5").getValue()).contains("5");
    assertThat(oracle.parseAnswer("   ").isResolved()).isFalse();
  }
}

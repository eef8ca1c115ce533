package com.autoapply.tool.easyapply.oracle.impl;

import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.client.RestClientException;
import com.autoapply.config.OracleConfig.OracleProperties;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.autoapply.tool.easyapply.oracle.AnswerOracle;
import com.autoapply.tool.easyapply.oracle.OracleAnswer;
import com.autoapply.tool.easyapply.oracle.OracleException;
import com.autoapply.tool.easyapply.oracle.client.GeminiClient;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers form questions with the Gemini model, using the applicant profile and the job as
 * context. Choice questions get numbered options and the model is asked for the number.
 */
@Slf4j
public class GeminiAnswerOracle implements AnswerOracle {

  static final String UNKNOWN_MARKER = "UNKNOWN";
  private static final int MAX_DESCRIPTION_CHARS = 3000;

  private final GeminiClient geminiClient;
  private final OracleProperties oracleProperties;

  public GeminiAnswerOracle(GeminiClient geminiClient, OracleProperties oracleProperties) {
    this.geminiClient = geminiClient;
    this.oracleProperties = oracleProperties;
  }

  @Override
  public OracleAnswer resolve(String question, FieldKind fieldKind, List<String> options,
      JobContext jobContext) {
    if (!geminiClient.isConfigured()) {
      log.debug("Gemini not configured, skipping question '{}'", question);
      return OracleAnswer.unresolved();
    }
    String prompt = buildPrompt(question, fieldKind, options, jobContext);
    try {
      String raw = geminiClient.generate(prompt);
      OracleAnswer answer = parseAnswer(raw);
      log.info("Gemini answered '{}' with '{}'", question, answer.getValue().orElse("<none>"));
      return answer;
    } catch (OracleException e) {
      log.warn("Gemini could not answer '{}' [{} {}]: {}", question, e.getErrorCode().getCode(),
          e.getErrorCode().getDefaultMessage(), e.getMessage());
      return OracleAnswer.unresolved();
    } catch (RestClientException e) {
      log.warn("Gemini could not answer '{}': {}", question, e.getMessage());
      return OracleAnswer.unresolved();
    }
  }

  @Override
  public String getName() {
    return "gemini";
  }

  String buildPrompt(String question, FieldKind fieldKind, List<String> options,
      JobContext jobContext) {
    StringBuilder prompt = new StringBuilder();
    prompt.append("You are filling in a job application form on behalf of an applicant.\n");
    if (StringUtils.isNotBlank(oracleProperties.getApplicantProfile())) {
      prompt.append("\nApplicant profile:\n").append(oracleProperties.getApplicantProfile().trim())
          .append("\n");
    }
    if (jobContext != null) {
      prompt.append("\nJob: ").append(jobContext.displayName()).append("\n");
      if (StringUtils.isNotBlank(jobContext.getLocation())) {
        prompt.append("Location: ").append(jobContext.getLocation()).append("\n");
      }
      if (StringUtils.isNotBlank(jobContext.getDescription())) {
        prompt.append("Description:\n")
            .append(StringUtils.abbreviate(jobContext.getDescription(), MAX_DESCRIPTION_CHARS))
            .append("\n");
      }
    }

    prompt.append("\nQuestion (").append(fieldKind.getValue()).append("): ").append(question)
        .append("\n");

    if (options != null && !options.isEmpty()) {
      prompt.append("Options:\n");
      for (int i = 0; i < options.size(); i++) {
        prompt.append(i + 1).append(". ").append(options.get(i)).append("\n");
      }
      prompt.append("\nReply with the number of the best option only.");
    } else if (fieldKind == FieldKind.TEXTAREA) {
      prompt.append("\nReply with a short professional answer of at most three sentences.");
    } else {
      prompt.append("\nReply with the answer only. Numeric questions take a plain number.");
    }
    prompt.append(" If the profile does not allow an answer, reply with ").append(UNKNOWN_MARKER)
        .append(".");
    return prompt.toString();
  }

  OracleAnswer parseAnswer(String raw) {
    if (StringUtils.isBlank(raw)) {
      return OracleAnswer.unresolved();
    }
    String text = StringUtils.strip(raw.trim(), "\"'`*");
    text = StringUtils.removeEnd(text.trim(), ".");
    if (text.equalsIgnoreCase(UNKNOWN_MARKER)) {
      return OracleAnswer.unresolved();
    }
    // "2. No" or "2) No" → 2
    if (text.matches("\\d+\\s*[.)].*")) {
      text = text.replaceFirst("^(\\d+).*$", "$1");
    }
    return OracleAnswer.of(text);
  }
}

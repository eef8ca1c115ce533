package com.autoapply.tool.easyapply.coverletter.impl;

import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import com.autoapply.config.OracleConfig.OracleProperties;
import com.autoapply.tool.easyapply.coverletter.CoverLetterGenerator;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.autoapply.tool.easyapply.oracle.OracleException;
import com.autoapply.tool.easyapply.oracle.client.GeminiClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class GeminiCoverLetterGenerator implements CoverLetterGenerator {

  private static final int MAX_DESCRIPTION_CHARS = 4000;
  private static final int MAX_FACTS = 40;

  private final GeminiClient geminiClient;
  private final OracleProperties oracleProperties;

  @Override
  public String generate(JobContext jobContext, Map<String, String> answers) {
    if (!geminiClient.isConfigured()) {
      log.info("Gemini not configured, using template cover letter");
      return CoverLetterTemplate.render(jobContext, answers);
    }
    try {
      String letter = geminiClient.generate(buildPrompt(jobContext, answers));
      if (StringUtils.isBlank(letter)) {
        return CoverLetterTemplate.render(jobContext, answers);
      }
      log.info("Generated cover letter of {} characters for {}", letter.length(),
          jobContext != null ? jobContext.displayName() : "unknown job");
      return letter;
    } catch (OracleException | RestClientException e) {
      log.warn("Cover letter generation failed, using template: {}", e.getMessage());
      return CoverLetterTemplate.render(jobContext, answers);
    }
  }

  String buildPrompt(JobContext jobContext, Map<String, String> answers) {
    StringBuilder prompt = new StringBuilder();
    prompt.append("Write a concise, professional cover letter (under 250 words) ")
        .append("for the job below. Plain text only, no placeholders in brackets.\n");
    if (jobContext != null) {
      prompt.append("\nJob: ").append(jobContext.displayName()).append("\n");
      if (StringUtils.isNotBlank(jobContext.getDescription())) {
        prompt.append("Description:\n")
            .append(StringUtils.abbreviate(jobContext.getDescription(), MAX_DESCRIPTION_CHARS))
            .append("\n");
      }
    }
    if (StringUtils.isNotBlank(oracleProperties.getApplicantProfile())) {
      prompt.append("\nApplicant profile:\n").append(oracleProperties.getApplicantProfile().trim())
          .append("\n");
    }
    if (answers != null && !answers.isEmpty()) {
      prompt.append("\nApplicant facts:\n");
      answers.entrySet().stream()
          .filter(e -> !e.getKey().toLowerCase().contains("cover letter"))
          .limit(MAX_FACTS)
          .forEach(e -> prompt.append("- ").append(e.getKey()).append(": ")
              .append(StringUtils.abbreviate(e.getValue(), 200)).append("\n"));
    }
    return prompt.toString();
  }
}

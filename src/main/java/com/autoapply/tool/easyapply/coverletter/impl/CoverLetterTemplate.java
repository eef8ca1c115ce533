package com.autoapply.tool.easyapply.coverletter.impl;

import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import com.autoapply.common.util.LabelUtils;
import com.autoapply.tool.easyapply.job.dto.JobContext;

/**
 * Local cover letter used when the language model is unavailable.
 */
public final class CoverLetterTemplate {

  private CoverLetterTemplate() {}

  public static String render(JobContext jobContext, Map<String, String> answers) {
    String position = jobContext != null && StringUtils.isNotBlank(jobContext.getTitle())
        ? jobContext.getTitle() + " position" : "open position";
    String company = jobContext != null && StringUtils.isNotBlank(jobContext.getCompany())
        ? jobContext.getCompany() : "your company";
    String name = StringUtils.normalizeSpace(
        answerFor(answers, "first name") + " " + answerFor(answers, "last name"));

    StringBuilder letter = new StringBuilder();
    letter.append("Dear Hiring Manager,\n\n");
    letter.append("I am writing to express my interest in the ").append(position)
        .append(" at ").append(company).append(". ");
    letter.append("My experience and skills match the requirements of this role, ")
        .append("and I am confident I can make a valuable contribution to your team.\n\n");
    letter.append("Thank you for considering my application. ")
        .append("I look forward to discussing how I can contribute to ").append(company)
        .append(".\n\n");
    letter.append("Sincerely,\n");
    letter.append(StringUtils.isNotBlank(name) ? name : "The Applicant");
    return letter.toString();
  }

  private static String answerFor(Map<String, String> answers, String label) {
    if (answers == null) {
      return "";
    }
    for (Map.Entry<String, String> entry : answers.entrySet()) {
      if (LabelUtils.normalize(entry.getKey()).equals(label)) {
        return StringUtils.defaultString(entry.getValue()).trim();
      }
    }
    return "";
  }
}

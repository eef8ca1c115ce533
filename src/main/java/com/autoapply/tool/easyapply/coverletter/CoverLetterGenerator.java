package com.autoapply.tool.easyapply.coverletter;

import java.util.Map;
import com.autoapply.tool.easyapply.job.dto.JobContext;

public interface CoverLetterGenerator {

  /**
   * Write a cover letter for one job
   *
   * @param jobContext the job applied to
   * @param answers snapshot of the stored answers, used as applicant facts
   * @return the letter text; never blank
   */
  String generate(JobContext jobContext, Map<String, String> answers);
}

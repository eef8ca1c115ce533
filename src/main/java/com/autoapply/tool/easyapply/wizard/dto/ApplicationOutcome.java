package com.autoapply.tool.easyapply.wizard.dto;

import java.time.LocalDateTime;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.autoapply.tool.easyapply.wizard.enums.OutcomeStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Terminal result of one application attempt
 */
@Value
@Builder
public class ApplicationOutcome {
  OutcomeStatus status;
  String reason;
  LocalDateTime timestamp;
  JobContext job;

  public static ApplicationOutcome success(JobContext job) {
    return of(OutcomeStatus.SUCCESS, "Application submitted", job);
  }

  public static ApplicationOutcome failure(JobContext job, String reason) {
    return of(OutcomeStatus.FAILURE, reason, job);
  }

  public static ApplicationOutcome incomplete(JobContext job, String reason) {
    return of(OutcomeStatus.INCOMPLETE, reason, job);
  }

  private static ApplicationOutcome of(OutcomeStatus status, String reason, JobContext job) {
    return ApplicationOutcome.builder()
        .status(status)
        .reason(reason)
        .timestamp(LocalDateTime.now())
        .job(job)
        .build();
  }

  public boolean isSuccess() {
    return status == OutcomeStatus.SUCCESS;
  }
}

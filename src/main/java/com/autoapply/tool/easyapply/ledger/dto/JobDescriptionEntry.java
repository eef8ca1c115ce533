package com.autoapply.tool.easyapply.ledger.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Archived description of a job that was applied to successfully
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobDescriptionEntry {
  @JsonProperty("job_id")
  private String jobId;
  private String title;
  private String company;
  private String description;

  /**
   * ISO-8601 local date-time of the archive write
   */
  private String timestamp;
}

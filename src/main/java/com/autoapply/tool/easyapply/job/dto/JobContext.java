package com.autoapply.tool.easyapply.job.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import lombok.Builder;
import lombok.Value;

/**
 * The job being applied to. Created once per application attempt and never modified during it.
 */
@Value
@Builder(toBuilder = true)
@JsonDeserialize(builder = JobContext.JobContextBuilder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobContext {
  String id;
  String title;
  String company;
  String description;
  String location;
  String url;

  /**
   * True when the caller already opened the application form
   */
  boolean entryAlreadyTriggered;

  @JsonPOJOBuilder(withPrefix = "")
  public static class JobContextBuilder {
  }

  public String displayName() {
    return (title != null ? title : "Unknown title") + " at "
        + (company != null ? company : "Unknown company");
  }
}

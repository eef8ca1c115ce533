package com.autoapply.common.util;

public class Constants {
  // Ledger files, relative to the data directory
  public static final String SUCCESSFUL_APPLICATIONS_FILE = "successful_applications.json";
  public static final String FAILED_APPLICATIONS_FILE = "failed_applications.json";
  public static final String JOB_DESCRIPTIONS_FILE = "job_descriptions_applied.json";

  // Field kind names passed to the answer oracle
  public static final String FIELD_KIND_TEXT = "text";
  public static final String FIELD_KIND_TEXTAREA = "textarea";
  public static final String FIELD_KIND_SELECT = "select";
  public static final String FIELD_KIND_RADIO = "radio";
  public static final String FIELD_KIND_CHECKBOX = "checkbox";
  public static final String FIELD_KIND_RESUME = "resume";

  public static final String UNKNOWN_JOB_ID = "unknown";

  private Constants() {}
}

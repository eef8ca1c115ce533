package com.autoapply.common.model;

/**
 * Standardized error codes so failures read the same in logs and outcome reasons.
 */
public enum ErrorCode {
  CONFIGURATION_ERROR(1001, "Invalid configuration"),
  UI_INTERACTION_ERROR(1100, "UI interaction failed"),
  ORACLE_ERROR(1200, "Answer oracle failed"),
  ORACLE_MALFORMED_RESPONSE(1201, "Answer oracle returned a malformed response"),
  ORACLE_QUOTA_EXCEEDED(1202, "Answer oracle quota exceeded"),
  STORAGE_ERROR(1300, "Durable storage failed");

  private final int code;
  private final String defaultMessage;

  ErrorCode(int code, String defaultMessage) {
    this.code = code;
    this.defaultMessage = defaultMessage;
  }

  public int getCode() {
    return code;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }
}

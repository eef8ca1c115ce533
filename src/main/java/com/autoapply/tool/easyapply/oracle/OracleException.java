package com.autoapply.tool.easyapply.oracle;

import com.autoapply.common.model.ErrorCode;

/**
 * Base exception for answer oracle failures: service unavailable, malformed response or quota
 */
public class OracleException extends RuntimeException {

  private final ErrorCode errorCode;

  public OracleException(String message) {
    super(message);
    this.errorCode = ErrorCode.ORACLE_ERROR;
  }

  public OracleException(String message, Throwable cause) {
    super(message, cause);
    this.errorCode = ErrorCode.ORACLE_ERROR;
  }

  public OracleException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }
}

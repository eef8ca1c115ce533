package com.autoapply.tool.easyapply.oracle;

import com.autoapply.common.model.ErrorCode;

/**
 * Thrown when the language model rejects a request for quota or rate-limit reasons
 */
public class OracleQuotaExceededException extends OracleException {

  private final Integer statusCode;

  public OracleQuotaExceededException(String message, Integer statusCode) {
    super(ErrorCode.ORACLE_QUOTA_EXCEEDED, message);
    this.statusCode = statusCode;
  }

  public Integer getStatusCode() {
    return statusCode;
  }
}

package com.autoapply.common.exception;

import com.autoapply.common.model.ErrorCode;

/**
 * Failure reading or writing one of the durable files (answers, ledgers, session cookies)
 */
public class StorageException extends RuntimeException {

  private final String path;

  public StorageException(String path, String message, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  public String getPath() {
    return path;
  }

  public ErrorCode getErrorCode() {
    return ErrorCode.STORAGE_ERROR;
  }
}

package com.autoapply.tool.easyapply.browser;

import com.autoapply.common.model.ErrorCode;

/**
 * Raised by the UI driver when an element cannot be found, a click times out or the underlying
 * browser session fails.
 */
public class UiInteractionException extends RuntimeException {

  private final ErrorCode errorCode;

  public UiInteractionException(String message) {
    super(message);
    this.errorCode = ErrorCode.UI_INTERACTION_ERROR;
  }

  public UiInteractionException(String message, Throwable cause) {
    super(message, cause);
    this.errorCode = ErrorCode.UI_INTERACTION_ERROR;
  }

  public UiInteractionException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }
}

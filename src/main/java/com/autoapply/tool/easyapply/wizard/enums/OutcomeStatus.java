package com.autoapply.tool.easyapply.wizard.enums;

public enum OutcomeStatus {
  SUCCESS,
  FAILURE,

  /**
   * The wizard stopped before submitting on purpose
   */
  INCOMPLETE
}

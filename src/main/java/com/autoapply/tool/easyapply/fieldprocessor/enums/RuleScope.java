package com.autoapply.tool.easyapply.fieldprocessor.enums;

public enum RuleScope {
  /**
   * Text and multi-line text fields
   */
  FREE_TEXT,

  /**
   * Select and radio fields offering both a Yes and a No option
   */
  YES_NO,

  /**
   * Any select or radio field
   */
  CHOICE
}

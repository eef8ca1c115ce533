package com.autoapply.tool.easyapply.fieldprocessor.enums;

import com.autoapply.common.util.Constants;

public enum FieldKind {
  TEXT(Constants.FIELD_KIND_TEXT),
  TEXTAREA(Constants.FIELD_KIND_TEXTAREA),
  SELECT(Constants.FIELD_KIND_SELECT),
  RADIO(Constants.FIELD_KIND_RADIO),
  CHECKBOX(Constants.FIELD_KIND_CHECKBOX),
  RESUME(Constants.FIELD_KIND_RESUME);

  private final String value;

  FieldKind(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}

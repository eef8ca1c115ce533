package com.autoapply.tool.easyapply.fieldprocessor;

import com.autoapply.tool.easyapply.answer.AnswerStore;
import com.autoapply.tool.easyapply.fieldprocessor.dto.FieldDescriptor;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;

/**
 * Resolves and applies the answer of one field kind.
 */
public interface FieldProcessor {

  FieldKind supportedKind();

  /**
   * Apply an answer to the field and persist it when it was newly resolved
   *
   * @return true when a value was applied
   */
  boolean process(FieldDescriptor field, AnswerStore answerStore);
}

package com.autoapply.tool.easyapply.fieldprocessor.impl;

import org.springframework.stereotype.Component;
import com.autoapply.tool.easyapply.answer.AnswerStore;
import com.autoapply.tool.easyapply.fieldprocessor.FieldProcessor;
import com.autoapply.tool.easyapply.fieldprocessor.dto.FieldDescriptor;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import lombok.extern.slf4j.Slf4j;

/**
 * The most recently uploaded resume is preselected by the job board, so nothing is changed.
 */
@Slf4j
@Component
public class ResumeFieldProcessor implements FieldProcessor {

  @Override
  public FieldKind supportedKind() {
    return FieldKind.RESUME;
  }

  @Override
  public boolean process(FieldDescriptor field, AnswerStore answerStore) {
    log.info("Keeping preselected resume for '{}'", field.getLabel());
    return true;
  }
}

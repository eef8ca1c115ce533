package com.autoapply.tool.easyapply.fieldprocessor.impl;

import org.springframework.stereotype.Component;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import com.autoapply.tool.easyapply.fieldprocessor.dto.FieldDescriptor;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.fieldprocessor.rule.AnswerRuleTable;
import com.autoapply.tool.easyapply.oracle.AnswerOracle;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class SelectFieldProcessor extends AbstractChoiceFieldProcessor {

  public SelectFieldProcessor(AnswerRuleTable ruleTable, AnswerOracle answerOracle) {
    super(ruleTable, answerOracle);
  }

  @Override
  public FieldKind supportedKind() {
    return FieldKind.SELECT;
  }

  @Override
  protected boolean apply(FieldDescriptor field, int index) {
    String option = field.getOptions().get(index);
    try {
      field.getHandle().selectOption(option);
      return true;
    } catch (UiInteractionException e) {
      log.error("Error selecting '{}' in '{}': {}", option, field.getLabel(), e.getMessage());
      return false;
    }
  }
}

package com.autoapply.tool.easyapply.fieldprocessor.impl;

import org.springframework.stereotype.Component;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.coverletter.CoverLetterGenerator;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.fieldprocessor.rule.AnswerRuleTable;
import com.autoapply.tool.easyapply.oracle.AnswerOracle;

@Component
public class TextareaFieldProcessor extends AbstractTextFieldProcessor {

  public TextareaFieldProcessor(AnswerRuleTable ruleTable, AnswerOracle answerOracle,
      CoverLetterGenerator coverLetterGenerator, EasyApplyProperties properties) {
    super(ruleTable, answerOracle, coverLetterGenerator, properties);
  }

  @Override
  public FieldKind supportedKind() {
    return FieldKind.TEXTAREA;
  }
}

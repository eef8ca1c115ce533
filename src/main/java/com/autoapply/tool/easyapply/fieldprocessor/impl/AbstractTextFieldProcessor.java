package com.autoapply.tool.easyapply.fieldprocessor.impl;

import java.util.Collections;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import com.autoapply.common.util.LabelUtils;
import com.autoapply.config.EasyApplyConfig.EasyApplyProperties;
import com.autoapply.tool.easyapply.answer.AnswerStore;
import com.autoapply.tool.easyapply.browser.UiInteractionException;
import com.autoapply.tool.easyapply.coverletter.CoverLetterGenerator;
import com.autoapply.tool.easyapply.fieldprocessor.FieldProcessor;
import com.autoapply.tool.easyapply.fieldprocessor.dto.FieldDescriptor;
import com.autoapply.tool.easyapply.fieldprocessor.rule.AnswerRuleTable;
import com.autoapply.tool.easyapply.oracle.AnswerOracle;
import com.autoapply.tool.easyapply.oracle.OracleAnswer;
import lombok.extern.slf4j.Slf4j;

/**
 * Free-text resolution: stored answer, then rule default, then oracle. Cover letter fields are
 * always generated fresh.
 */
@Slf4j
public abstract class AbstractTextFieldProcessor implements FieldProcessor {

  static final String COVER_LETTER_KEYWORD = "cover letter";

  protected final AnswerRuleTable ruleTable;
  protected final AnswerOracle answerOracle;
  protected final CoverLetterGenerator coverLetterGenerator;
  protected final EasyApplyProperties properties;

  protected AbstractTextFieldProcessor(AnswerRuleTable ruleTable, AnswerOracle answerOracle,
      CoverLetterGenerator coverLetterGenerator, EasyApplyProperties properties) {
    this.ruleTable = ruleTable;
    this.answerOracle = answerOracle;
    this.coverLetterGenerator = coverLetterGenerator;
    this.properties = properties;
  }

  @Override
  public boolean process(FieldDescriptor field, AnswerStore answerStore) {
    String label = field.getLabel();

    if (LabelUtils.normalize(label).contains(COVER_LETTER_KEYWORD)) {
      String letter = coverLetterGenerator.generate(field.getJobContext(), answerStore.snapshot());
      if (!fill(field, letter)) {
        return false;
      }
      answerStore.set(label, letter);
      return true;
    }

    Optional<String> stored = answerStore.get(label);
    if (stored.isPresent()) {
      log.debug("Using stored answer for '{}'", label);
      return fill(field, stored.get());
    }

    Optional<String> ruleDefault = ruleTable.textDefault(label);
    if (ruleDefault.isPresent()) {
      log.info("Default answer '{}' for '{}'", ruleDefault.get(), label);
      return fill(field, ruleDefault.get());
    }

    OracleAnswer answer = answerOracle.resolve(label, supportedKind(), Collections.emptyList(),
        field.getJobContext());
    if (answer.isResolved()) {
      String value = answer.getValue().orElseThrow();
      if (!fill(field, value)) {
        return false;
      }
      answerStore.set(label, value);
      return true;
    }

    String fallback = properties.getDefaults().getFallbackText();
    log.warn("No answer for '{}', filling fallback text", label);
    if (StringUtils.isNotEmpty(fallback)) {
      fill(field, fallback);
    }
    return false;
  }

  protected boolean fill(FieldDescriptor field, String value) {
    try {
      field.getHandle().fill(value);
      log.info("Filled {} '{}'", supportedKind().getValue(), field.getLabel());
      return true;
    } catch (UiInteractionException e) {
      log.error("Error filling {} '{}': {}", supportedKind().getValue(), field.getLabel(),
          e.getMessage());
      return false;
    }
  }
}

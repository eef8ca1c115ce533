package com.autoapply.tool.easyapply.oracle.impl;

import java.util.List;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.job.dto.JobContext;
import com.autoapply.tool.easyapply.oracle.AnswerOracle;
import com.autoapply.tool.easyapply.oracle.OracleAnswer;
import lombok.extern.slf4j.Slf4j;

/**
 * Consults its delegates in order and returns the first resolved answer.
 */
@Slf4j
public class ChainedAnswerOracle implements AnswerOracle {

  private final List<AnswerOracle> delegates;

  public ChainedAnswerOracle(List<AnswerOracle> delegates) {
    this.delegates = List.copyOf(delegates);
  }

  @Override
  public OracleAnswer resolve(String question, FieldKind fieldKind, List<String> options,
      JobContext jobContext) {
    for (AnswerOracle delegate : delegates) {
      OracleAnswer answer;
      try {
        answer = delegate.resolve(question, fieldKind, options, jobContext);
      } catch (RuntimeException e) {
        log.warn("Oracle {} failed on '{}': {}", delegate.getName(), question, e.getMessage());
        continue;
      }
      if (answer != null && answer.isResolved()) {
        return answer;
      }
      log.debug("Oracle {} left '{}' unresolved", delegate.getName(), question);
    }
    return OracleAnswer.unresolved();
  }

  @Override
  public String getName() {
    return "chain";
  }
}

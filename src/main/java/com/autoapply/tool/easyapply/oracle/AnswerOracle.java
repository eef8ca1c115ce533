package com.autoapply.tool.easyapply.oracle;

import java.util.List;
import com.autoapply.tool.easyapply.fieldprocessor.enums.FieldKind;
import com.autoapply.tool.easyapply.job.dto.JobContext;

/**
 * Produces an answer for a question that has no stored answer. Implementations may ask a language
 * model or a human; callers never branch on which.
 */
public interface AnswerOracle {

  /**
   * Resolve one question
   *
   * @param question the field label
   * @param fieldKind kind of the field being filled
   * @param options option texts for choice fields, empty for free text
   * @param jobContext the job being applied to, may be null
   * @return the answer, or {@link OracleAnswer#unresolved()}; never throws
   */
  OracleAnswer resolve(String question, FieldKind fieldKind, List<String> options,
      JobContext jobContext);

  /**
   * Provider name used in configuration
   */
  String getName();
}

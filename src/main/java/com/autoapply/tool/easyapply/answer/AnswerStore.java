package com.autoapply.tool.easyapply.answer;

import java.util.Map;
import java.util.Optional;

/**
 * Durable question label to answer mapping. Lookups are exact on the normalized label
 * (whitespace collapsed, case-folded).
 */
public interface AnswerStore {

  Optional<String> get(String label);

  /**
   * Store or overwrite the answer for a label and persist immediately. A failed write is logged
   * and the in-memory value is kept.
   */
  void set(String label, String value);

  /**
   * Read-only copy keyed by the label spelling last written
   */
  Map<String, String> snapshot();

  /**
   * Flush to disk
   *
   * @return false when the write failed
   */
  boolean save();
}

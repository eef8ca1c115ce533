package com.autoapply.tool.easyapply.oracle;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Result of an oracle call: free text, an option text, a 1-based option number as text, or the
 * {@link #unresolved()} sentinel. An unresolved answer must never be stored.
 */
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class OracleAnswer {

  private static final OracleAnswer UNRESOLVED = new OracleAnswer(null);

  private final String value;

  public static OracleAnswer of(String value) {
    if (value == null || value.isBlank()) {
      return UNRESOLVED;
    }
    return new OracleAnswer(value.trim());
  }

  public static OracleAnswer unresolved() {
    return UNRESOLVED;
  }

  public boolean isResolved() {
    return value != null;
  }

  public Optional<String> getValue() {
    return Optional.ofNullable(value);
  }
}

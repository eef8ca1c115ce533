package com.autoapply.common.util;

import java.util.Collection;
import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * Text helpers for question labels and option texts.
 */
public final class LabelUtils {

  private LabelUtils() {}

  /**
   * Normalized form used as Answer Store key: whitespace collapsed, trimmed, case-folded
   */
  public static String normalize(String label) {
    if (label == null) {
      return "";
    }
    return StringUtils.normalizeSpace(label).toLowerCase(Locale.ROOT);
  }

  public static boolean containsAny(String text, Collection<String> keywords) {
    if (StringUtils.isBlank(text) || keywords == null) {
      return false;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    for (String keyword : keywords) {
      if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Label text as rendered, with the repeated line that screen-reader markup produces removed
   */
  public static String clean(String raw) {
    if (raw == null) {
      return "";
    }
    String text = raw.trim();
    String[] lines = text.split("\\R");
    if (lines.length == 2 && lines[0].trim().equals(lines[1].trim())) {
      text = lines[0];
    }
    return StringUtils.normalizeSpace(text);
  }

  public static boolean isYes(String answer) {
    String a = normalize(answer);
    return a.equals("yes") || a.equals("true") || a.equals("1");
  }

  public static boolean isNo(String answer) {
    String a = normalize(answer);
    return a.equals("no") || a.equals("false") || a.equals("0");
  }
}

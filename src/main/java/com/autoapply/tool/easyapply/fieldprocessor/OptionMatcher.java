package com.autoapply.tool.easyapply.fieldprocessor;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import com.autoapply.common.util.LabelUtils;

/**
 * Maps a free-form answer back to one of a field's option texts.
 */
public final class OptionMatcher {

  private OptionMatcher() {}

  /**
   * Index of the option the answer designates: a 1-based number, then an exact text, then the
   * closest text
   */
  public static Optional<Integer> match(String answer, List<String> options) {
    if (StringUtils.isBlank(answer) || options == null || options.isEmpty()) {
      return Optional.empty();
    }
    String trimmed = answer.trim();
    if (trimmed.matches("\\d+")) {
      int index = Integer.parseInt(trimmed) - 1;
      if (index >= 0 && index < options.size()) {
        return Optional.of(index);
      }
    }
    Optional<Integer> exact = matchExact(trimmed, options);
    if (exact.isPresent()) {
      return exact;
    }
    return matchFuzzy(trimmed, options);
  }

  /**
   * Case-insensitive exact match on normalized text
   */
  public static Optional<Integer> matchExact(String answer, List<String> options) {
    if (StringUtils.isBlank(answer) || options == null) {
      return Optional.empty();
    }
    String wanted = LabelUtils.normalize(answer);
    for (int i = 0; i < options.size(); i++) {
      if (LabelUtils.normalize(options.get(i)).equals(wanted)) {
        return Optional.of(i);
      }
    }
    return Optional.empty();
  }

  static Optional<Integer> matchFuzzy(String answer, List<String> options) {
    String wanted = LabelUtils.normalize(answer);

    // option text containing the whole answer, e.g. "Yes" in "Yes, I am"
    for (int i = 0; i < options.size(); i++) {
      if (containsWords(LabelUtils.normalize(options.get(i)), wanted)) {
        return Optional.of(i);
      }
    }

    // answer containing a whole option, longest option first
    int best = -1;
    int bestLength = 0;
    for (int i = 0; i < options.size(); i++) {
      String option = LabelUtils.normalize(options.get(i));
      if (option.length() > bestLength && containsWords(wanted, option)) {
        best = i;
        bestLength = option.length();
      }
    }
    return best >= 0 ? Optional.of(best) : Optional.empty();
  }

  private static boolean containsWords(String haystack, String needle) {
    if (needle.isEmpty()) {
      return false;
    }
    Pattern pattern = Pattern.compile("(^|\\W)" + Pattern.quote(needle) + "($|\\W)");
    return pattern.matcher(haystack).find();
  }
}

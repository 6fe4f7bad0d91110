package com.gentoro.lawmcp.citation;

import com.gentoro.lawmcp.exception.ConfigException;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Article number (flno) helpers: normalization and "preceding article" arithmetic. */
public final class ArticleIds {
  private static final Pattern FLNO = Pattern.compile("(\\d+)(?:-(\\d+))?");

  private ArticleIds() {}

  public static boolean isValid(String id) {
    return id != null && FLNO.matcher(id).matches();
  }

  /**
   * {@code "16-1"} and {@code "12"} come back unchanged; Chinese numerals are converted ({@code
   * "十六"} → {@code "16"}). Anything else yields empty.
   */
  public static Optional<String> normalize(String raw) {
    String s = raw == null ? "" : raw.strip();
    if (isValid(s)) {
      return Optional.of(s);
    }
    OptionalInt value = ChineseNumerals.toInt(s);
    return value.isPresent() ? Optional.of(Integer.toString(value.getAsInt())) : Optional.empty();
  }

  /**
   * The article "前條" refers to when written inside article {@code currentId}.
   *
   * <ul>
   *   <li>{@code 16-1} → {@code 16}: an inserted article follows its base article
   *   <li>{@code 16-0} and {@code 16} → {@code 15}
   *   <li>{@code 1} → {@code 1}: there is no predecessor, the id is returned unchanged
   * </ul>
   *
   * @throws ConfigException when {@code currentId} is not an article number
   */
  public static String preceding(String currentId) {
    Matcher m = currentId == null ? null : FLNO.matcher(currentId.strip());
    if (m == null || !m.matches()) {
      throw new ConfigException("Malformed current article id: '" + currentId + "'");
    }
    int major;
    int minor;
    try {
      major = Integer.parseInt(m.group(1));
      minor = m.group(2) == null ? -1 : Integer.parseInt(m.group(2));
    } catch (NumberFormatException e) {
      throw new ConfigException("Article id out of range: '" + currentId + "'", e);
    }
    if (minor > 0) {
      return Integer.toString(major);
    }
    return Integer.toString(major > 1 ? major - 1 : major);
  }
}

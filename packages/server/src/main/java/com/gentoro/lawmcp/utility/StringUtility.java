package com.gentoro.lawmcp.utility;

import java.util.regex.Pattern;

public class StringUtility {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /** Collapse every whitespace run (including full-width and NBSP) to one space and trim. */
  public static String collapseWhitespace(String input) {
    if (input == null) return "";
    String normalized = input.replace('\u00A0', ' ').replace('\u3000', ' ');
    return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
  }

  public static boolean isBlank(String input) {
    return input == null || input.isBlank();
  }

  /** Trimmed value, or {@code null} when blank. */
  public static String trimToNull(String input) {
    if (input == null) return null;
    String trimmed = input.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}

package com.gentoro.lawmcp.citation;

import com.gentoro.lawmcp.exception.CitationParseException;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Converts the numerals used in article, paragraph, subparagraph and item numbers to integers.
 *
 * <p>Accepts plain ASCII digits ("12") or Chinese numerals built from the digits 零〇一二三四五六七八九
 * (兩 counts as 2) and the units 十 and 百, which covers 1 to 999: "十"=10, "十二"=12, "二十三"=23,
 * "一百零五"=105.
 */
public final class ChineseNumerals {
  /** Character class of every numeral character accepted by {@link #toInt(String)}. */
  public static final String NUMERAL_CLASS = "[零〇一二兩三四五六七八九十百]";

  private static final Map<Character, Integer> DIGITS =
      Map.ofEntries(
          Map.entry('零', 0),
          Map.entry('〇', 0),
          Map.entry('一', 1),
          Map.entry('二', 2),
          Map.entry('兩', 2),
          Map.entry('三', 3),
          Map.entry('四', 4),
          Map.entry('五', 5),
          Map.entry('六', 6),
          Map.entry('七', 7),
          Map.entry('八', 8),
          Map.entry('九', 9));

  private static final Map<Character, Integer> UNITS = Map.of('十', 10, '百', 100);

  private ChineseNumerals() {}

  /** The value of {@code s}, or empty when it is blank, holds anything unrecognized or overflows. */
  public static OptionalInt toInt(String s) {
    String input = s == null ? "" : s.strip();
    if (input.isEmpty()) {
      return OptionalInt.empty();
    }
    if (isAsciiDigits(input)) {
      try {
        return OptionalInt.of(Integer.parseInt(input));
      } catch (NumberFormatException e) {
        return OptionalInt.empty();
      }
    }

    int total = 0;
    Integer num = null;
    try {
      for (int i = 0; i < input.length(); i++) {
        char ch = input.charAt(i);
        Integer digit = DIGITS.get(ch);
        if (digit != null) {
          num = digit;
          continue;
        }
        Integer unit = UNITS.get(ch);
        if (unit == null) {
          return OptionalInt.empty();
        }
        total = Math.addExact(total, Math.multiplyExact(num == null || num == 0 ? 1 : num, unit));
        num = null;
      }
      return OptionalInt.of(Math.addExact(total, num == null ? 0 : num));
    } catch (ArithmeticException e) {
      return OptionalInt.empty();
    }
  }

  /**
   * Like {@link #toInt(String)} but for citation captures: the value must be a positive index.
   *
   * @throws CitationParseException when the text is not a numeral or is zero
   */
  public static int parseIndex(String s) {
    OptionalInt value = toInt(s);
    if (value.isEmpty()) {
      throw new CitationParseException("Not a numeral", s);
    }
    if (value.getAsInt() < 1) {
      throw new CitationParseException("Index must be 1 or greater", s);
    }
    return value.getAsInt();
  }

  static boolean isAsciiDigits(String s) {
    if (s.isEmpty()) return false;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') return false;
    }
    return true;
  }
}

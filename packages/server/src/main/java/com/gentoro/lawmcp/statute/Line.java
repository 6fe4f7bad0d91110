package com.gentoro.lawmcp.statute;

import java.util.Objects;

/**
 * One line of article text.
 *
 * @param text the line text, whitespace already collapsed
 * @param enumerated true when the source renders the line as a numbered paragraph (項)
 */
public record Line(String text, boolean enumerated) {
  public Line {
    Objects.requireNonNull(text, "text");
  }

  public static Line plain(String text) {
    return new Line(text, false);
  }

  public static Line enumerated(String text) {
    return new Line(text, true);
  }
}

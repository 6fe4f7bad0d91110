package com.gentoro.lawmcp.statute;

import java.util.List;

/**
 * A single article (條) of a law, tagged with the chapter and section it was found under.
 *
 * @param id the article number (flno), e.g. {@code 16} or {@code 16-1}
 * @param displayLabel label as shown on the page, e.g. {@code 第 16-1 條}
 * @param lines article text
 * @param chapterTitle title of the enclosing chapter, null when none was seen yet
 * @param sectionTitle title of the enclosing section, null when none is open
 * @param truncated true when lines were dropped in summary mode
 */
public record Article(
    String id,
    String displayLabel,
    List<Line> lines,
    String chapterTitle,
    String sectionTitle,
    boolean truncated) {
  public Article {
    lines = List.copyOf(lines);
  }
}

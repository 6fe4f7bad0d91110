package com.gentoro.lawmcp.statute;

import java.util.List;

/**
 * A unit of a law page in document order: a chapter heading, a section heading or an article row.
 * Produced by a {@link ContentBlockSource} and consumed once, in order, by {@link
 * DocumentStructurer}.
 */
public sealed interface ContentBlock
    permits ContentBlock.ChapterHeading, ContentBlock.SectionHeading, ContentBlock.ArticleRow {

  /** 章 */
  record ChapterHeading(String title) implements ContentBlock {}

  /** 節 */
  record SectionHeading(String title) implements ContentBlock {}

  /**
   * An article row. {@code id} or {@code lines} is null when the row had no anchor or no article
   * container; such rows are boilerplate and get skipped.
   */
  record ArticleRow(String id, String displayLabel, List<Line> lines) implements ContentBlock {}
}

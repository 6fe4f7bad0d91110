package com.gentoro.lawmcp.citation;

import com.gentoro.lawmcp.statute.Line;
import java.util.List;

/**
 * A single article as delivered by an {@link ArticleFetcher}.
 *
 * @param articleId article number read from the page, null when the page does not show one
 * @param displayLabel label such as {@code 第 16-1 條}
 * @param url where the article was read from, or any other handle the fetcher uses
 */
public record RawArticleContent(
    String articleId, String displayLabel, String url, List<Line> lines) {
  public RawArticleContent {
    lines = lines == null ? List.of() : List.copyOf(lines);
  }
}

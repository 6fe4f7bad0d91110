package com.gentoro.lawmcp.statute;

import java.util.List;

/**
 * The two views of a structured law: the chapter tree and the flat article list. Both hold the
 * same {@link Article} instances in source order.
 *
 * @param meta present only when the law was structured with summary mode or an article limit
 */
public record LawStructure(List<Chapter> chapters, List<Article> articles, Meta meta) {
  public LawStructure {
    chapters = List.copyOf(chapters);
    articles = List.copyOf(articles);
  }

  public record Meta(int totalParsed, boolean summaryMode, int maxArticles) {}
}

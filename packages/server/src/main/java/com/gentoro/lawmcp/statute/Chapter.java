package com.gentoro.lawmcp.statute;

import java.util.List;

/**
 * 章: a titled group of sections, plus the articles that sit directly under the chapter without a
 * section. The title is empty for the chapter synthesized for content that precedes any heading.
 */
public record Chapter(String title, List<Section> sections, List<Article> articles) {
  public Chapter {
    sections = List.copyOf(sections);
    articles = List.copyOf(articles);
  }
}

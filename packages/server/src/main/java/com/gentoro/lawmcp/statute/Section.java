package com.gentoro.lawmcp.statute;

import java.util.List;

/** 節: a titled group of articles inside a chapter. */
public record Section(String title, List<Article> articles) {
  public Section {
    articles = List.copyOf(articles);
  }
}

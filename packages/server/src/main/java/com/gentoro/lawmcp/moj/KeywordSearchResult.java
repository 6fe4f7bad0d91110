package com.gentoro.lawmcp.moj;

import java.util.List;

public record KeywordSearchResult(String keyword, int count, List<KeywordHit> results, Meta meta) {
  public KeywordSearchResult {
    results = List.copyOf(results);
  }

  public record Meta(int maxResults, boolean summaryOnly) {}
}

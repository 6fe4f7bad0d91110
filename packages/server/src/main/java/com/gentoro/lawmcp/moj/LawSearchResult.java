package com.gentoro.lawmcp.moj;

import java.util.List;

/**
 * Outcome of a search by law name. {@code result} is set for exact and single matches, {@code
 * suggestions} only for multiple matches.
 */
public record LawSearchResult(SearchStatus status, LawHit result, List<LawHit> suggestions) {
  public LawSearchResult {
    suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
  }

  /**
   * Exact name match wins, then a lone hit; otherwise the first {@code maxSuggestions} hits are
   * offered.
   */
  public static LawSearchResult classify(String query, List<LawHit> hits, int maxSuggestions) {
    String wanted = query == null ? "" : query.trim();
    for (LawHit hit : hits) {
      if (hit.name().equals(wanted)) {
        return new LawSearchResult(SearchStatus.EXACT_MATCH, hit, List.of());
      }
    }
    if (hits.size() == 1) {
      return new LawSearchResult(SearchStatus.SINGLE_MATCH, hits.get(0), List.of());
    }
    if (hits.isEmpty()) {
      return new LawSearchResult(SearchStatus.NO_MATCH, null, List.of());
    }
    return new LawSearchResult(
        SearchStatus.MULTIPLE_MATCHES,
        null,
        hits.subList(0, Math.min(hits.size(), Math.max(maxSuggestions, 0))));
  }
}

package com.gentoro.lawmcp.statute;

/**
 * Controls how much of a law is kept while structuring.
 *
 * @param summaryMode keep only the first line of each article
 * @param maxArticles stop after this many articles; 0 means no limit
 */
public record StructuringOptions(boolean summaryMode, int maxArticles) {
  public static final StructuringOptions FULL = new StructuringOptions(false, 0);

  public StructuringOptions {
    if (maxArticles < 0) {
      throw new IllegalArgumentException("maxArticles must be >= 0");
    }
  }

  boolean limited() {
    return summaryMode || maxArticles > 0;
  }
}

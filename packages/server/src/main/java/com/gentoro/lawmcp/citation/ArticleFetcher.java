package com.gentoro.lawmcp.citation;

import com.gentoro.lawmcp.exception.FetchException;

/** Retrieves one article of one law. Implementations must be safe for concurrent use. */
@FunctionalInterface
public interface ArticleFetcher {

  /**
   * @param lawId law code (pcode), e.g. {@code G0320015}
   * @param articleId article number, e.g. {@code 16-1}
   * @throws FetchException when the article cannot be retrieved
   */
  RawArticleContent fetch(String lawId, String articleId) throws FetchException;
}

package com.gentoro.lawmcp.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/** A referenced article could not be retrieved (unavailable, unparseable or timed out). */
public class FetchException extends LawMcpException {
  public FetchException(String lawId, String articleId, String message) {
    super(LawMcpErrorCode.FETCH_ERROR, message, context(lawId, articleId));
  }

  public FetchException(String lawId, String articleId, String message, Throwable cause) {
    super(LawMcpErrorCode.FETCH_ERROR, message, context(lawId, articleId), cause);
  }

  private static Map<String, Object> context(String lawId, String articleId) {
    Map<String, Object> ctx = new LinkedHashMap<>();
    ctx.put("lawId", lawId);
    ctx.put("articleId", articleId);
    return ctx;
  }
}

package com.gentoro.lawmcp.citation;

import com.gentoro.lawmcp.statute.Line;
import java.util.List;

/**
 * Outcome of resolving one {@link Reference}.
 *
 * <p>On success {@code selectedText} holds the requested unit, or, when it could not be pinpointed,
 * {@code fallbackLines} holds the whole target article. On failure only {@code matchedText}, {@code
 * targetId} and {@code error} are set.
 */
public record ResolvedReference(
    String matchedText,
    String targetId,
    String targetLabel,
    String url,
    Integer item,
    Integer clause,
    Integer subitem,
    SelectionLevel selectedLevel,
    String selectedText,
    List<Line> fallbackLines,
    String error) {

  static ResolvedReference selected(
      Reference ref, RawArticleContent target, SelectionLevel level, String text) {
    return new ResolvedReference(
        ref.matchedText(),
        targetIdOf(ref, target),
        target.displayLabel(),
        target.url(),
        ref.item(),
        ref.clause(),
        ref.subitem(),
        level,
        text,
        null,
        null);
  }

  static ResolvedReference wholeArticle(Reference ref, RawArticleContent target) {
    return new ResolvedReference(
        ref.matchedText(),
        targetIdOf(ref, target),
        target.displayLabel(),
        target.url(),
        ref.item(),
        ref.clause(),
        ref.subitem(),
        null,
        null,
        target.lines(),
        null);
  }

  static ResolvedReference failed(Reference ref, String error) {
    return new ResolvedReference(
        ref.matchedText(),
        ref.targetId(),
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        error == null || error.isBlank() ? "unknown error" : error);
  }

  public boolean hasError() {
    return error != null;
  }

  private static String targetIdOf(Reference ref, RawArticleContent target) {
    String fromPage = target.articleId();
    return fromPage == null || fromPage.isBlank() ? ref.targetId() : fromPage;
  }
}

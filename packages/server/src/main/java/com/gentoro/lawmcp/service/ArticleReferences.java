package com.gentoro.lawmcp.service;

import com.gentoro.lawmcp.citation.RawArticleContent;
import com.gentoro.lawmcp.citation.ResolvedReference;
import java.util.List;

/**
 * An article together with the text of every provision it cites.
 *
 * @param references in order of first appearance in the article, capped by the budget
 */
public record ArticleReferences(
    Meta meta, RawArticleContent article, List<ResolvedReference> references, int referenceCount) {

  public record Meta(String pcode, String name, String url) {}
}

package com.gentoro.lawmcp.moj;

import java.util.List;

/**
 * The first article of a law whose text contains the keyword.
 *
 * @param matchedLines lines containing the keyword, ignoring case
 * @param lines all lines of the article; null in summary-only searches
 */
public record KeywordHit(
    String lawName,
    String pcode,
    String flno,
    String noText,
    String url,
    List<String> matchedLines,
    List<String> lines) {}

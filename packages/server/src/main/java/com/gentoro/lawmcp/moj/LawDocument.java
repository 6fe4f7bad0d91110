package com.gentoro.lawmcp.moj;

import org.jsoup.nodes.Document;

/** A fetched full-law page together with the pcode and URL it came from. */
public record LawDocument(String pcode, String url, Document document) {}

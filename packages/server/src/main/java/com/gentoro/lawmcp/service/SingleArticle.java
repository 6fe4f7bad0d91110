package com.gentoro.lawmcp.service;

import com.gentoro.lawmcp.citation.RawArticleContent;

public record SingleArticle(String pcode, String lawName, String url, RawArticleContent article) {}

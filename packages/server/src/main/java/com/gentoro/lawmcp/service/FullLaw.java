package com.gentoro.lawmcp.service;

import com.gentoro.lawmcp.statute.Article;
import com.gentoro.lawmcp.statute.Chapter;
import com.gentoro.lawmcp.statute.LawStructure;
import java.util.List;

/** A whole law: flat article list, chapter tree, and {@code meta} when the law was cut down. */
public record FullLaw(
    String name,
    String pcode,
    String url,
    List<Article> articles,
    List<Chapter> structure,
    LawStructure.Meta meta) {}

package com.gentoro.lawmcp.service;

import com.gentoro.lawmcp.citation.CitationSettings;
import com.gentoro.lawmcp.citation.RawArticleContent;
import com.gentoro.lawmcp.citation.Reference;
import com.gentoro.lawmcp.citation.ReferenceExtractor;
import com.gentoro.lawmcp.citation.ReferenceResolver;
import com.gentoro.lawmcp.citation.ResolvedReference;
import com.gentoro.lawmcp.exception.NotFoundException;
import com.gentoro.lawmcp.exception.ValidationException;
import com.gentoro.lawmcp.moj.KeywordSearchResult;
import com.gentoro.lawmcp.moj.LawDocument;
import com.gentoro.lawmcp.moj.LawHit;
import com.gentoro.lawmcp.moj.LawSearchResult;
import com.gentoro.lawmcp.moj.MojLawClient;
import com.gentoro.lawmcp.statute.DocumentStructurer;
import com.gentoro.lawmcp.statute.LawStructure;
import com.gentoro.lawmcp.statute.StructuringOptions;
import com.gentoro.lawmcp.utility.StringUtility;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;

/**
 * Use cases behind the MCP tools and the command line: law lookup, full text, single articles,
 * keyword search and article reference resolution.
 *
 * <p>Laws are addressed by pcode or by name. A name is resolved through the name search and must
 * identify exactly one law.
 */
public class LawQueryService {
  private static final org.slf4j.Logger log =
      com.gentoro.lawmcp.logging.LoggingService.getLogger(LawQueryService.class);

  private final MojLawClient client;
  private final DocumentStructurer structurer;
  private final ReferenceExtractor extractor;
  private final ReferenceResolver resolver;
  private final CitationSettings citationSettings;
  private final int defaultMaxSuggestions;
  private final int defaultMaxResults;

  public LawQueryService(MojLawClient client, Configuration cfg) {
    this(
        client,
        CitationSettings.fromConfiguration(cfg),
        cfg == null ? 5 : cfg.getInt("search.max-suggestions", 5),
        cfg == null ? 10 : cfg.getInt("search.max-results", 10));
  }

  public LawQueryService(
      MojLawClient client,
      CitationSettings citationSettings,
      int defaultMaxSuggestions,
      int defaultMaxResults) {
    this.client = client;
    this.citationSettings = citationSettings;
    this.structurer = new DocumentStructurer();
    this.extractor = new ReferenceExtractor(citationSettings);
    this.resolver = new ReferenceResolver(citationSettings);
    this.defaultMaxSuggestions = defaultMaxSuggestions;
    this.defaultMaxResults = defaultMaxResults;
  }

  public LawSearchResult searchLaw(String name, Integer maxSuggestions) {
    return client.searchByName(
        name, positiveOr(maxSuggestions, defaultMaxSuggestions, "max_suggestions"));
  }

  public PcodeLookup lookupPcode(String name) {
    String pcode = client.resolvePcode(name).orElse(null);
    return new PcodeLookup(name, pcode, pcode != null);
  }

  public PcodeValidation validatePcode(String pcode) {
    return new PcodeValidation(pcode, client.validatePcode(pcode));
  }

  public FullLaw fullLaw(String pcode, String name, StructuringOptions options) {
    Target target = target(pcode, name);
    LawDocument doc = client.fetchLaw(target.pcode());
    LawStructure structure =
        structurer.structure(client.parser().nextBlocks(doc.document()), options);
    String lawName =
        target.name() != null ? target.name() : client.parser().lawName(doc.document()).orElse(null);
    log.debug("Law {} ({}): {} articles", target.pcode(), lawName, structure.articles().size());
    return new FullLaw(
        lawName,
        target.pcode(),
        doc.url(),
        structure.articles(),
        structure.chapters(),
        structure.meta());
  }

  public SingleArticle singleArticle(String pcode, String name, String article) {
    if (StringUtility.isBlank(article)) {
      throw new ValidationException("article must not be blank");
    }
    Target target = target(pcode, name);
    RawArticleContent content = client.fetchArticle(target.pcode(), article.trim());
    return new SingleArticle(target.pcode(), target.name(), content.url(), content);
  }

  public KeywordSearchResult keywordSearch(String keyword, Integer maxResults, Boolean summaryOnly) {
    return client.keywordSearch(
        keyword,
        positiveOr(maxResults, defaultMaxResults, "max_results"),
        summaryOnly == null || summaryOnly);
  }

  /**
   * Fetches article {@code flno}, extracts its cross references and resolves at most {@code
   * maxRefs} of them (the configured default when null).
   */
  public ArticleReferences articleReferences(
      String pcode, String name, String flno, Integer maxRefs) {
    if (StringUtility.isBlank(flno)) {
      throw new ValidationException("flno must not be blank");
    }
    int budget = positiveOr(maxRefs, citationSettings.maxRefs(), "max_refs");
    Target target = target(pcode, name);

    RawArticleContent article = client.fetchArticle(target.pcode(), flno.trim());
    String currentId = article.articleId() != null ? article.articleId() : flno.trim();
    List<Reference> refs = extractor.extractReferences(currentId, article.lines());
    List<ResolvedReference> resolved =
        refs.isEmpty() ? List.of() : resolver.resolve(target.pcode(), refs, client, budget);
    log.info(
        "Article {} of {}: {} references, {} resolved",
        currentId,
        target.pcode(),
        refs.size(),
        resolved.size());
    return new ArticleReferences(
        new ArticleReferences.Meta(target.pcode(), target.name(), article.url()),
        article,
        resolved,
        resolved.size());
  }

  private Target target(String pcode, String name) {
    String code = StringUtility.trimToNull(pcode);
    if (code != null) {
      return new Target(code, StringUtility.trimToNull(name));
    }
    if (StringUtility.isBlank(name)) {
      throw new ValidationException("Either pcode or name must be provided");
    }
    LawSearchResult result = client.searchByName(name, defaultMaxSuggestions);
    if (!result.status().resolved()) {
      String suggestions =
          result.suggestions().stream().map(LawHit::name).collect(Collectors.joining(", "));
      throw new NotFoundException(
          "No unique law named '%s'%s"
              .formatted(
                  name.trim(), suggestions.isEmpty() ? "" : " (did you mean: " + suggestions + ")"));
    }
    return new Target(result.result().pcode(), result.result().name());
  }

  private static int positiveOr(Integer value, int fallback, String name) {
    if (value == null) {
      return fallback;
    }
    if (value <= 0) {
      throw new ValidationException(name + " must be > 0, got " + value);
    }
    return value;
  }

  private record Target(String pcode, String name) {}
}

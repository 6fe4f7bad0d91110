package com.gentoro.lawmcp.moj;

import com.gentoro.lawmcp.citation.ArticleFetcher;
import com.gentoro.lawmcp.citation.RawArticleContent;
import com.gentoro.lawmcp.exception.FetchException;
import com.gentoro.lawmcp.exception.LawMcpException;
import com.gentoro.lawmcp.exception.NetworkException;
import com.gentoro.lawmcp.exception.ValidationException;
import com.gentoro.lawmcp.http.OkHttpFactory;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/** Client of the laws database at law.moj.gov.tw. Thread-safe. */
public class MojLawClient implements ArticleFetcher {
  private static final org.slf4j.Logger log =
      com.gentoro.lawmcp.logging.LoggingService.getLogger(MojLawClient.class);

  public static final String DEFAULT_BASE_URL = "https://law.moj.gov.tw/";

  private final HttpUrl baseUrl;
  private final OkHttpClient http;
  private final OkHttpClient noRedirects;
  private final LawPageParser parser;

  public MojLawClient(Configuration cfg) {
    this(baseUrl(cfg), OkHttpFactory.create(cfg));
  }

  public MojLawClient(String baseUrl, OkHttpClient http) {
    this.baseUrl = HttpUrl.get(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
    this.http = http;
    // a pcode is valid only if the law page answers directly
    this.noRedirects = http.newBuilder().followRedirects(false).build();
    this.parser = new LawPageParser(this.baseUrl.toString());
  }

  public LawPageParser parser() {
    return parser;
  }

  /** Searches laws by name through the home page search form. */
  public LawSearchResult searchByName(String name, int maxSuggestions) {
    requireText(name, "name");
    FormState state = parser.formState(get(baseUrl));

    FormBody.Builder form =
        new FormBody.Builder()
            .add("__VIEWSTATE", state.viewState())
            .add("__VIEWSTATEGENERATOR", state.viewStateGenerator())
            .add("__EVENTTARGET", "")
            .add("__EVENTARGUMENT", "")
            .add("__VIEWSTATEENCRYPTED", "")
            .add("ctl00$hidMode", "")
            .add("ctl00$hidVal", "ONEBAR")
            .add("ctl00$hidkw", "")
            .add("ctl00$keyword", "")
            .add("ctl00$msKeyword", name.trim())
            .add("ctl00$btnMsQall", "查詢")
            .add("ctl00$txtEMail", "");
    if (!state.eventValidation().isEmpty()) {
      form.add("__EVENTVALIDATION", state.eventValidation());
    }
    Document results = execute(new Request.Builder().url(baseUrl).post(form.build()).build());
    LawSearchResult result =
        LawSearchResult.classify(name, parser.searchResults(results), maxSuggestions);
    log.debug("Name search '{}': {}", name, result.status().label());
    return result;
  }

  /** The pcode of the law called {@code name}, when the search identifies exactly one law. */
  public Optional<String> resolvePcode(String name) {
    LawSearchResult result = searchByName(name, 1);
    return result.status().resolved() ? Optional.of(result.result().pcode()) : Optional.empty();
  }

  /** True when the full-law page of {@code pcode} answers HTTP 200. Network errors yield false. */
  public boolean validatePcode(String pcode) {
    requireText(pcode, "pcode");
    Request request = new Request.Builder().url(lawAllUrl(pcode)).head().build();
    try (Response response = noRedirects.newCall(request).execute()) {
      return response.code() == 200;
    } catch (IOException e) {
      log.debug("Validating pcode {} failed: {}", pcode, e.toString());
      return false;
    }
  }

  public LawDocument fetchLaw(String pcode) {
    requireText(pcode, "pcode");
    HttpUrl url = lawAllUrl(pcode);
    return new LawDocument(pcode.trim(), url.toString(), get(url));
  }

  public RawArticleContent fetchArticle(String pcode, String flno) {
    requireText(pcode, "pcode");
    requireText(flno, "flno");
    HttpUrl url =
        baseUrl
            .newBuilder()
            .addPathSegments("LawClass/LawSingle.aspx")
            .addQueryParameter("pcode", pcode.trim())
            .addQueryParameter("flno", flno.trim())
            .build();
    return parser.singleArticle(get(url), url.toString());
  }

  @Override
  public RawArticleContent fetch(String lawId, String articleId) throws FetchException {
    try {
      return fetchArticle(lawId, articleId);
    } catch (FetchException e) {
      throw e;
    } catch (LawMcpException e) {
      throw new FetchException(lawId, articleId, e.getMessage(), e);
    }
  }

  /**
   * Full-text search. For each of the first {@code maxResults} laws listed, reports the first
   * article shown on its search-content page with the lines mentioning the keyword. Laws whose
   * page fails or shows no matching line are left out.
   */
  public KeywordSearchResult keywordSearch(String keyword, int maxResults, boolean summaryOnly) {
    requireText(keyword, "keyword");
    HttpUrl listUrl =
        baseUrl
            .newBuilder()
            .addPathSegments("Law/LawSearchResult.aspx")
            .addQueryParameter("cur", "Ld")
            .addQueryParameter("ty", "ONEBAR")
            .addQueryParameter("kw", keyword)
            .build();
    List<LawLink> laws = parser.keywordLawLinks(get(listUrl));
    String needle = keyword.toLowerCase(Locale.ROOT);

    List<KeywordHit> hits = new ArrayList<>();
    for (LawLink law : laws.subList(0, Math.min(laws.size(), Math.max(maxResults, 0)))) {
      HttpUrl contentUrl =
          baseUrl
              .newBuilder()
              .addPathSegments("LawClass/LawSearchContent.aspx")
              .addQueryParameter("pcode", law.pcode())
              .addQueryParameter("kw", keyword)
              .build();
      Document page;
      try {
        page = get(contentUrl);
      } catch (NetworkException e) {
        log.warn("Skipping {} ({}): {}", law.name(), law.pcode(), e.getMessage());
        continue;
      }
      Optional<String> flno = parser.firstArticleNumber(page);
      if (flno.isEmpty()) {
        continue;
      }
      List<String> lines = parser.articleText(page);
      List<String> matched =
          lines.stream().filter(l -> l.toLowerCase(Locale.ROOT).contains(needle)).toList();
      if (matched.isEmpty()) {
        continue;
      }
      hits.add(
          new KeywordHit(
              law.name(),
              law.pcode(),
              flno.get(),
              "第 " + flno.get() + " 條",
              parser.lawSingleUrl(law.pcode(), flno.get()),
              matched,
              summaryOnly ? null : lines));
    }
    log.debug("Keyword '{}': {} of {} laws matched", keyword, hits.size(), laws.size());
    return new KeywordSearchResult(
        keyword, hits.size(), hits, new KeywordSearchResult.Meta(maxResults, summaryOnly));
  }

  private HttpUrl lawAllUrl(String pcode) {
    return baseUrl
        .newBuilder()
        .addPathSegments("LawClass/LawAll.aspx")
        .addQueryParameter("pcode", pcode.trim())
        .build();
  }

  private Document get(HttpUrl url) {
    return execute(new Request.Builder().url(url).get().build());
  }

  private Document execute(Request request) {
    try (Response response = http.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new NetworkException(
            "%s %s failed with status %d"
                .formatted(request.method(), request.url(), response.code()));
      }
      ResponseBody body = response.body();
      String html = body == null ? "" : body.string();
      return Jsoup.parse(html, response.request().url().toString());
    } catch (IOException e) {
      throw new NetworkException(
          "%s %s could not be executed".formatted(request.method(), request.url()), e);
    }
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(name + " must not be blank");
    }
  }

  private static String baseUrl(Configuration cfg) {
    return cfg == null ? DEFAULT_BASE_URL : cfg.getString("law.base-url", DEFAULT_BASE_URL);
  }
}

package com.gentoro.lawmcp.moj;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.lawmcp.citation.RawArticleContent;
import com.gentoro.lawmcp.exception.FetchException;
import com.gentoro.lawmcp.exception.NetworkException;
import com.gentoro.lawmcp.exception.StructuralException;
import com.gentoro.lawmcp.exception.ValidationException;
import com.gentoro.lawmcp.http.OkHttpFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import okhttp3.FormBody;
import okhttp3.Request;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MojLawClientTest {

  private StubInterceptor stub;
  private MojLawClient client;

  @BeforeEach
  void setUp() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("law.base-url", "https://law.test/");
    cfg.setProperty("law.http.user-agent", "law-mcp-test");
    stub = new StubInterceptor();
    client = new MojLawClient("https://law.test/", OkHttpFactory.create(cfg, stub));
  }

  static String html(String name) throws IOException {
    try (InputStream in = MojLawClientTest.class.getResourceAsStream("/moj/" + name)) {
      assertNotNull(in, "missing fixture " + name);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private static Map<String, String> form(Request request) {
    FormBody body = (FormBody) request.body();
    Map<String, String> fields = new HashMap<>();
    for (int i = 0; i < body.size(); i++) {
      fields.put(body.name(i), body.value(i));
    }
    return fields;
  }

  @Test
  void searchByNamePostsFormStateAndFindsExactMatch() throws IOException {
    stub.on("GET", "/", 200, html("home.html")).on("POST", "/", 200, html("search-results.html"));

    LawSearchResult result = client.searchByName(" 民法 ", 5);

    assertEquals(SearchStatus.EXACT_MATCH, result.status());
    assertEquals("B0000001", result.result().pcode());
    assertTrue(result.suggestions().isEmpty());

    Request post = stub.requests.get(1);
    Map<String, String> fields = form(post);
    assertEquals("vs-token", fields.get("__VIEWSTATE"));
    assertEquals("CA0B0334", fields.get("__VIEWSTATEGENERATOR"));
    assertEquals("ev-token", fields.get("__EVENTVALIDATION"));
    assertEquals("民法", fields.get("ctl00$msKeyword"));
    assertEquals("ONEBAR", fields.get("ctl00$hidVal"));
    assertEquals("law-mcp-test", post.header("User-Agent"));
    assertEquals("https://law.test/", post.header("Referer"));
  }

  @Test
  void searchWithoutExactMatchOffersSuggestions() throws IOException {
    stub.on("GET", "/", 200, html("home.html")).on("POST", "/", 200, html("search-results.html"));

    LawSearchResult result = client.searchByName("施行法", 2);

    assertEquals(SearchStatus.MULTIPLE_MATCHES, result.status());
    assertNull(result.result());
    assertEquals(2, result.suggestions().size());
  }

  @Test
  void homePageWithoutViewStateFailsSearch() {
    stub.on("GET", "/", 200, "<html><body>maintenance</body></html>");

    assertThrows(StructuralException.class, () -> client.searchByName("民法", 5));
  }

  @Test
  void resolvePcodeNeedsUniqueHit() throws IOException {
    stub.on("GET", "/", 200, html("home.html")).on("POST", "/", 200, html("search-results.html"));

    assertEquals("B0000001", client.resolvePcode("民法").orElseThrow());
    assertTrue(client.resolvePcode("不存在").isEmpty());
  }

  @Test
  void validatePcodeAcceptsOnlyHttp200() {
    stub.on("HEAD", "/LawClass/LawAll.aspx", "B0000001", 200, "")
        .on("HEAD", "/LawClass/LawAll.aspx", "MOVED", 302, "");

    assertTrue(client.validatePcode("B0000001"));
    assertFalse(client.validatePcode("MOVED"));
    assertFalse(client.validatePcode("NOPE"));
    assertEquals("HEAD", stub.requests.get(0).method());
  }

  @Test
  void validatePcodeTreatsNetworkErrorsAsInvalid() {
    stub.fail("HEAD", "/LawClass/LawAll.aspx", new SocketTimeoutException("timeout"));

    assertFalse(client.validatePcode("B0000001"));
  }

  @Test
  void fetchesSingleArticle() throws IOException {
    stub.on("GET", "/LawClass/LawSingle.aspx", "B0000001", 200, html("law-single.html"));

    RawArticleContent article = client.fetchArticle("B0000001", "16-1");

    assertEquals("16-1", article.articleId());
    assertEquals(2, article.lines().size());
    assertEquals("16-1", stub.requests.get(0).url().queryParameter("flno"));
    assertEquals(
        "https://law.test/LawClass/LawSingle.aspx?pcode=B0000001&flno=16-1", article.url());
  }

  @Test
  void fetchWrapsFailuresInFetchException() {
    stub.on("GET", "/LawClass/LawSingle.aspx", 500, "oops");

    FetchException e = assertThrows(FetchException.class, () -> client.fetch("B0000001", "9"));
    assertInstanceOf(NetworkException.class, e.getCause());
    assertEquals("9", e.getContext().get("articleId"));
  }

  @Test
  void fetchLawReturnsParsedDocument() throws IOException {
    stub.on("GET", "/LawClass/LawAll.aspx", "B0000001", 200, html("law-all.html"));

    LawDocument doc = client.fetchLaw("B0000001");

    assertEquals("B0000001", doc.pcode());
    assertEquals(7, client.parser().nextBlocks(doc.document()).size());
  }

  @Test
  void keywordSearchKeepsLawsWithMatchingLines() throws IOException {
    stub.on("GET", "/Law/LawSearchResult.aspx", 200, html("keyword-results.html"))
        .on("GET", "/LawClass/LawSearchContent.aspx", "A0000001", 200, html("keyword-content-a.html"))
        .on("GET", "/LawClass/LawSearchContent.aspx", "D0020010", 500, "")
        .on(
            "GET",
            "/LawClass/LawSearchContent.aspx",
            "Z9999999",
            200,
            html("keyword-content-none.html"));

    KeywordSearchResult result = client.keywordSearch("選舉", 10, true);

    assertEquals(1, result.count());
    KeywordHit hit = result.results().get(0);
    assertEquals("憲法", hit.lawName());
    assertEquals("17", hit.flno());
    assertEquals("第 17 條", hit.noText());
    assertEquals(1, hit.matchedLines().size());
    assertNull(hit.lines());
    assertEquals(new KeywordSearchResult.Meta(10, true), result.meta());
    assertEquals("選舉", stub.requests.get(0).url().queryParameter("kw"));
  }

  @Test
  void keywordSearchHonorsMaxResultsAndFullLines() throws IOException {
    stub.on("GET", "/Law/LawSearchResult.aspx", 200, html("keyword-results.html"))
        .on(
            "GET",
            "/LawClass/LawSearchContent.aspx",
            "A0000001",
            200,
            html("keyword-content-a.html"));

    KeywordSearchResult result = client.keywordSearch("選舉", 1, false);

    assertEquals(1, result.count());
    assertEquals(2, result.results().get(0).lines().size());
    assertEquals(2, stub.requests.size());
  }

  @Test
  void blankArgumentsAreRejected() {
    assertThrows(ValidationException.class, () -> client.searchByName(" ", 5));
    assertThrows(ValidationException.class, () -> client.fetchArticle("B0000001", ""));
    assertThrows(ValidationException.class, () -> client.keywordSearch(null, 5, true));
    assertTrue(stub.requests.isEmpty());
  }
}

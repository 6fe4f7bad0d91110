package com.gentoro.lawmcp.moj;

import com.gentoro.lawmcp.citation.RawArticleContent;
import com.gentoro.lawmcp.exception.StructuralException;
import com.gentoro.lawmcp.statute.ContentBlock;
import com.gentoro.lawmcp.statute.ContentBlockSource;
import com.gentoro.lawmcp.statute.Line;
import com.gentoro.lawmcp.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Reads the pages of the laws database (law.moj.gov.tw).
 *
 * <p>A full-law page keeps everything under {@code div.law-reg-content}: chapter headings are
 * {@code div.h3.char-2}, section headings {@code div.h3.char-3}, and each article a {@code div.row}
 * whose {@code .col-no a} anchor carries the article number in its {@code name} attribute. Article
 * lines are the {@code line-*} divs inside {@code .col-data .law-article}; {@code show-number} marks
 * a numbered paragraph.
 */
public class LawPageParser implements ContentBlockSource<Document> {
  private static final org.slf4j.Logger log =
      com.gentoro.lawmcp.logging.LoggingService.getLogger(LawPageParser.class);

  private static final Pattern ARTICLE_MARKER = Pattern.compile("第\\s*([\\d\\-]+)\\s*條");
  private static final Pattern PCODE_PARAM =
      Pattern.compile("pcode=([A-Z0-9]+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern TITLE_CUT = Pattern.compile("[（(]EN[）)]|－|–|\\|");

  private final String baseUrl;

  public LawPageParser(String baseUrl) {
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
  }

  @Override
  public List<ContentBlock> nextBlocks(Document doc) {
    Element root = doc.selectFirst("div.law-reg-content");
    if (root == null) {
      throw new StructuralException("Law page has no div.law-reg-content");
    }
    List<ContentBlock> blocks = new ArrayList<>();
    for (Element node : root.children()) {
      if (!node.normalName().equals("div")) {
        continue;
      }
      if (node.hasClass("h3") && node.hasClass("char-2")) {
        blocks.add(new ContentBlock.ChapterHeading(node.text().trim()));
      } else if (node.hasClass("h3") && node.hasClass("char-3")) {
        blocks.add(new ContentBlock.SectionHeading(node.text().trim()));
      } else if (node.hasClass("row")) {
        blocks.add(articleRow(node));
      }
    }
    log.trace("Read {} blocks from {}", blocks.size(), doc.location());
    return blocks;
  }

  private ContentBlock.ArticleRow articleRow(Element row) {
    Element anchor = row.selectFirst(".col-no a");
    Element body = row.selectFirst(".col-data .law-article");
    if (anchor == null || body == null) {
      return new ContentBlock.ArticleRow(null, null, null);
    }
    return new ContentBlock.ArticleRow(
        anchor.attr("name").trim(), anchor.text().trim(), lines(body.select("div")));
  }

  /**
   * Parses a single-article page.
   *
   * @param url recorded on the result
   * @throws StructuralException when the page has no article row
   */
  public RawArticleContent singleArticle(Document doc, String url) {
    Element row = doc.selectFirst("div.law-reg-content > div.row");
    if (row == null) {
      row = doc.selectFirst("div.row");
    }
    if (row == null) {
      throw new StructuralException("Article page has no div.row");
    }

    Element no = row.selectFirst(".col-no");
    String noText = no == null ? "" : no.text().trim();
    String flno = null;
    Matcher m = ARTICLE_MARKER.matcher(noText);
    if (m.find()) {
      flno = m.group(1);
    }
    Element anchor = row.selectFirst(".col-no a");
    if (flno == null && anchor != null && anchor.hasAttr("name")) {
      flno = StringUtility.trimToNull(anchor.attr("name"));
    }
    return new RawArticleContent(
        flno,
        noText.isEmpty() ? null : noText,
        url,
        lines(row.select(".col-data .law-article div")));
  }

  /** @throws StructuralException when {@code __VIEWSTATE} or {@code __VIEWSTATEGENERATOR} is missing */
  public FormState formState(Document doc) {
    String viewState = inputValue(doc, "__VIEWSTATE");
    String generator = inputValue(doc, "__VIEWSTATEGENERATOR");
    if (viewState.isEmpty() || generator.isEmpty()) {
      throw new StructuralException("Home page has no __VIEWSTATE / __VIEWSTATEGENERATOR");
    }
    return new FormState(viewState, generator, inputValue(doc, "__EVENTVALIDATION"));
  }

  /** Laws listed on a name search result page, in page order. */
  public List<LawHit> searchResults(Document doc) {
    List<LawHit> hits = new ArrayList<>();
    for (Element a : doc.select("a#hlkLawLink")) {
      Optional<String> pcode = pcodeOf(a);
      if (pcode.isEmpty()) {
        log.debug("Search hit '{}' has no pcode in '{}'", a.text(), a.attr("href"));
        continue;
      }
      hits.add(new LawHit(a.text().trim(), pcode.get(), lawAllUrl(pcode.get())));
    }
    return hits;
  }

  /** Unique (pcode, name) law links of a keyword search result page. */
  public List<LawLink> keywordLawLinks(Document doc) {
    Set<LawLink> links = new LinkedHashSet<>();
    for (Element a : doc.select("a[href*=AddHotLaw.ashx], a[href*=LawSearchContent.aspx]")) {
      pcodeOf(a).ifPresent(pcode -> links.add(new LawLink(a.text().trim(), pcode)));
    }
    return List.copyOf(links);
  }

  /** Number of the first "第 N 條" marker on the page. */
  public Optional<String> firstArticleNumber(Document doc) {
    Matcher m = ARTICLE_MARKER.matcher(doc.text());
    return m.find() ? Optional.of(m.group(1)) : Optional.empty();
  }

  /** All article lines of the page as plain text. */
  public List<String> articleText(Document doc) {
    return lines(doc.select(".law-article div")).stream().map(Line::text).toList();
  }

  /** Name of the law: {@code #hlLawName} or the first {@code h2}, else the cut-down page title. */
  public Optional<String> lawName(Document doc) {
    Element heading = doc.selectFirst("#hlLawName");
    if (heading == null) {
      heading = doc.selectFirst("h2");
    }
    if (heading != null && !heading.text().isBlank()) {
      return Optional.of(heading.text().trim());
    }
    String title = doc.title();
    if (title == null || title.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(StringUtility.trimToNull(TITLE_CUT.split(title, 2)[0]));
  }

  public String lawAllUrl(String pcode) {
    return baseUrl + "LawClass/LawAll.aspx?pcode=" + pcode;
  }

  public String lawSingleUrl(String pcode, String flno) {
    return baseUrl + "LawClass/LawSingle.aspx?pcode=" + pcode + "&flno=" + flno;
  }

  private static List<Line> lines(List<Element> candidates) {
    List<Line> lines = new ArrayList<>();
    for (Element d : candidates) {
      if (d.classNames().stream().noneMatch(c -> c.startsWith("line-"))) {
        continue;
      }
      String text = StringUtility.collapseWhitespace(d.text());
      if (!text.isEmpty()) {
        lines.add(new Line(text, d.hasClass("show-number")));
      }
    }
    return lines;
  }

  private static String inputValue(Document doc, String id) {
    Element input = doc.selectFirst("input#" + id);
    return input == null ? "" : input.attr("value");
  }

  private static Optional<String> pcodeOf(Element a) {
    Matcher m = PCODE_PARAM.matcher(a.attr("href"));
    return m.find() ? Optional.of(m.group(1)) : Optional.empty();
  }
}

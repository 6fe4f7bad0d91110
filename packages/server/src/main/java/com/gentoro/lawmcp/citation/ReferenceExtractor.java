package com.gentoro.lawmcp.citation;

import com.gentoro.lawmcp.exception.CitationParseException;
import com.gentoro.lawmcp.statute.Line;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the cross references in an article's text.
 *
 * <p>Each line is scanned by an ordered list of rules, most specific first:
 *
 * <ol>
 *   <li>第A條第Y項至第Z項, then 第A條第Y項
 *   <li>第A條第Y款至第Z款, then 第A條第Y款
 *   <li>第A條第Y目至第Z目, then 第A條第Y目
 *   <li>第A條 not followed by a 項/款/目 qualifier
 *   <li>前條, optionally followed by 第N項, 第N款 or 第N目
 * </ol>
 *
 * A match that overlaps a span already taken by an earlier rule on the same line is ignored, so a
 * qualified citation never also yields a bare article reference. Ranges within the configured cap
 * expand to one reference per index; wider or inverted ranges keep only the start index. Results
 * are deduplicated on {@link Reference#identity()}, first occurrence wins.
 */
public class ReferenceExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.lawmcp.logging.LoggingService.getLogger(ReferenceExtractor.class);

  private static final String NUMERAL = ChineseNumerals.NUMERAL_CLASS + "+";
  private static final String INDEX = "(?:\\d+|" + NUMERAL + ")";
  // 第十六條之一 is the written form of article 16-1
  private static final String ARTICLE =
      "(?:本法)?第\\s*(?<art>\\d+(?:-\\d+)?|"
          + NUMERAL
          + ")\\s*條(?:\\s*之\\s*(?<sub>"
          + INDEX
          + "))?";

  private static final List<Rule> RULES =
      List.of(
          Rule.range(SelectionLevel.ITEM),
          Rule.single(SelectionLevel.ITEM),
          Rule.range(SelectionLevel.CLAUSE),
          Rule.single(SelectionLevel.CLAUSE),
          Rule.range(SelectionLevel.SUBITEM),
          Rule.single(SelectionLevel.SUBITEM),
          new Rule(
              RuleType.ARTICLE,
              null,
              Pattern.compile(ARTICLE + "(?!\\s*第\\s*" + INDEX + "\\s*[項款目])")),
          new Rule(
              RuleType.PRECEDING,
              null,
              Pattern.compile(
                  "前條(?:\\s*第\\s*(?<start>" + INDEX + ")\\s*(?<level>[項款目]))?")));

  private final CitationSettings settings;

  public ReferenceExtractor() {
    this(CitationSettings.DEFAULTS);
  }

  public ReferenceExtractor(CitationSettings settings) {
    this.settings = settings == null ? CitationSettings.DEFAULTS : settings;
  }

  /**
   * @param currentArticleId number of the article the lines belong to; only consulted when the text
   *     contains a 前條 reference
   * @throws com.gentoro.lawmcp.exception.ConfigException when a 前條 reference is present and
   *     {@code currentArticleId} is not a valid article number
   */
  public List<Reference> extractReferences(String currentArticleId, List<Line> lines) {
    Collector collector = new Collector(currentArticleId);
    if (lines == null) {
      return List.of();
    }
    for (Line line : lines) {
      if (line != null && line.text() != null && !line.text().isEmpty()) {
        scanLine(line.text(), collector);
      }
    }
    List<Reference> refs = collector.result();
    log.debug(
        "Article {}: {} references ({} duplicates, {} unparseable matches dropped)",
        currentArticleId,
        refs.size(),
        collector.duplicates,
        collector.discarded);
    return refs;
  }

  private void scanLine(String text, Collector collector) {
    List<int[]> taken = new ArrayList<>();
    for (Rule rule : RULES) {
      Matcher m = rule.pattern().matcher(text);
      while (m.find()) {
        if (overlaps(taken, m.start(), m.end())) {
          continue;
        }
        try {
          read(rule, m, collector);
          taken.add(new int[] {m.start(), m.end()});
        } catch (CitationParseException e) {
          collector.discarded++;
          log.debug("Discarding citation '{}': {} ({})", m.group(), e.getMessage(), e.getInput());
        }
      }
    }
  }

  private void read(Rule rule, Matcher m, Collector collector) {
    String hit = m.group();
    switch (rule.type()) {
      case ARTICLE -> collector.add(Reference.of(ReferenceKind.EXPLICIT, articleId(m), null, null, hit));
      case SINGLE -> {
        String target = articleId(m);
        int index = ChineseNumerals.parseIndex(m.group("start"));
        collector.add(Reference.of(ReferenceKind.EXPLICIT, target, rule.level(), index, hit));
      }
      case RANGE -> {
        String target = articleId(m);
        int start = ChineseNumerals.parseIndex(m.group("start"));
        OptionalInt end = ChineseNumerals.toInt(m.group("end"));
        int last = start;
        if (end.isPresent()
            && end.getAsInt() >= start
            && end.getAsInt() - start <= settings.rangeCap(rule.level())) {
          last = end.getAsInt();
        } else {
          log.debug("Range '{}' not expanded, keeping start index {}", hit, start);
        }
        for (int k = start; k <= last; k++) {
          collector.add(Reference.of(ReferenceKind.EXPLICIT, target, rule.level(), k, hit));
        }
      }
      case PRECEDING -> {
        SelectionLevel level = SelectionLevel.ofMarker(m.group("level"));
        Integer index = level == null ? null : ChineseNumerals.parseIndex(m.group("start"));
        collector.add(
            Reference.of(ReferenceKind.RELATIVE, collector.precedingId(), level, index, hit));
      }
    }
  }

  private static String articleId(Matcher m) {
    String raw = m.group("art");
    String base =
        ArticleIds.normalize(raw)
            .orElseThrow(() -> new CitationParseException("Unrecognized article number", raw));
    String sub = m.group("sub");
    if (sub == null) {
      return base;
    }
    if (base.contains("-")) {
      throw new CitationParseException("Article number has two suffixes", m.group());
    }
    return base + "-" + ChineseNumerals.parseIndex(sub);
  }

  private static boolean overlaps(List<int[]> taken, int start, int end) {
    for (int[] span : taken) {
      if (start < span[1] && span[0] < end) {
        return true;
      }
    }
    return false;
  }

  private enum RuleType {
    RANGE,
    SINGLE,
    ARTICLE,
    PRECEDING
  }

  private record Rule(RuleType type, SelectionLevel level, Pattern pattern) {
    static Rule range(SelectionLevel level) {
      char k = level.marker();
      return new Rule(
          RuleType.RANGE,
          level,
          Pattern.compile(
              ARTICLE
                  + "\\s*第\\s*(?<start>"
                  + INDEX
                  + ")\\s*"
                  + k
                  + "\\s*至\\s*第\\s*(?<end>"
                  + INDEX
                  + ")\\s*"
                  + k));
    }

    static Rule single(SelectionLevel level) {
      return new Rule(
          RuleType.SINGLE,
          level,
          Pattern.compile(ARTICLE + "\\s*第\\s*(?<start>" + INDEX + ")\\s*" + level.marker()));
    }
  }

  /** Per-call dedup state; the preceding article id is computed on first use. */
  private static final class Collector {
    private final String currentArticleId;
    private final Map<Reference.Identity, Reference> refs = new LinkedHashMap<>();
    private String precedingId;
    private int duplicates;
    private int discarded;

    Collector(String currentArticleId) {
      this.currentArticleId = currentArticleId;
    }

    String precedingId() {
      if (precedingId == null) {
        precedingId = ArticleIds.preceding(currentArticleId);
        if (precedingId.equals(currentArticleId == null ? null : currentArticleId.strip())) {
          log.debug("Article {} has no predecessor; 前條 resolves to itself", currentArticleId);
        }
      }
      return precedingId;
    }

    void add(Reference ref) {
      if (refs.putIfAbsent(ref.identity(), ref) != null) {
        duplicates++;
      }
    }

    List<Reference> result() {
      return List.copyOf(refs.values());
    }
  }
}

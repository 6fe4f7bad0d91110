package com.gentoro.lawmcp.citation;

import com.gentoro.lawmcp.statute.Line;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Picks the paragraph, subparagraph or item a reference asks for out of the target article's lines.
 *
 * <p>Statute pages mark only paragraphs (項) explicitly; subparagraphs and items are recognized by
 * their line prefixes: {@code 一、} or {@code 1.} for 款, {@code （一）} or {@code 1.} for 目.
 */
public class SubUnitSelector {
  private static final Pattern CLAUSE_PREFIX =
      Pattern.compile("^(?:" + ChineseNumerals.NUMERAL_CLASS + "+、|\\d+[.．])");
  private static final Pattern SUBITEM_PREFIX =
      Pattern.compile("^(?:[（(]" + ChineseNumerals.NUMERAL_CLASS + "+[)）]|\\d+[.．])");

  public record Selection(SelectionLevel level, String text) {}

  /**
   * Tries item, then clause, then subitem, using whichever index the reference carries. Empty when
   * the reference has no qualifier or the index is out of range.
   */
  public Optional<Selection> select(Reference ref, List<Line> lines) {
    if (lines == null || lines.isEmpty()) {
      return Optional.empty();
    }
    if (ref.item() != null) {
      String text = pickItem(lines, ref.item());
      if (text != null) return Optional.of(new Selection(SelectionLevel.ITEM, text));
    }
    if (ref.clause() != null) {
      String text = pickPrefixed(lines, ref.clause(), l -> CLAUSE_PREFIX.matcher(l).find());
      if (text != null) return Optional.of(new Selection(SelectionLevel.CLAUSE, text));
    }
    if (ref.subitem() != null) {
      String text = pickPrefixed(lines, ref.subitem(), l -> SUBITEM_PREFIX.matcher(l).find());
      if (text != null) return Optional.of(new Selection(SelectionLevel.SUBITEM, text));
    }
    return Optional.empty();
  }

  /** 1-based; numbered lines first, plain line order when the page numbers inconsistently. */
  String pickItem(List<Line> lines, int index) {
    if (index < 1) return null;
    List<Line> numbered = lines.stream().filter(Line::enumerated).toList();
    if (index <= numbered.size()) {
      return numbered.get(index - 1).text();
    }
    return index <= lines.size() ? lines.get(index - 1).text() : null;
  }

  String pickPrefixed(List<Line> lines, int index, Predicate<String> prefix) {
    if (index < 1) return null;
    List<Line> matching = lines.stream().filter(l -> prefix.test(l.text())).toList();
    return index <= matching.size() ? matching.get(index - 1).text() : null;
  }
}

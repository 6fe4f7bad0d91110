package com.gentoro.lawmcp.citation;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.lawmcp.statute.Line;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SubUnitSelectorTest {

  private final SubUnitSelector selector = new SubUnitSelector();

  private static final List<Line> ARTICLE =
      List.of(
          Line.enumerated("有下列情形之一者，處罰之："),
          Line.plain("一、未經許可者。"),
          Line.plain("（一）初犯。"),
          Line.plain("（二）再犯。"),
          Line.plain("二、逾期未改善者。"),
          Line.enumerated("前項罰鍰，由主管機關處分之。"));

  private static Reference ref(SelectionLevel level, int index) {
    return Reference.of(ReferenceKind.EXPLICIT, "5", level, index, "第五條");
  }

  @Test
  void itemsCountNumberedLinesOnly() {
    Optional<SubUnitSelector.Selection> s = selector.select(ref(SelectionLevel.ITEM, 2), ARTICLE);

    assertTrue(s.isPresent());
    assertEquals(SelectionLevel.ITEM, s.get().level());
    assertEquals("前項罰鍰，由主管機關處分之。", s.get().text());
  }

  @Test
  void itemFallsBackToLineOrderWhenNotEnoughNumberedLines() {
    Optional<SubUnitSelector.Selection> s = selector.select(ref(SelectionLevel.ITEM, 3), ARTICLE);

    assertEquals("（一）初犯。", s.orElseThrow().text());
  }

  @Test
  void clausesAreRecognizedByPrefix() {
    assertEquals(
        "二、逾期未改善者。", selector.select(ref(SelectionLevel.CLAUSE, 2), ARTICLE).orElseThrow().text());
    assertEquals(
        "2. second",
        selector
            .select(
                ref(SelectionLevel.CLAUSE, 2), List.of(Line.plain("1. first"), Line.plain("2. second")))
            .orElseThrow()
            .text());
  }

  @Test
  void subitemsAreRecognizedByPrefix() {
    Optional<SubUnitSelector.Selection> s = selector.select(ref(SelectionLevel.SUBITEM, 2), ARTICLE);

    assertEquals(SelectionLevel.SUBITEM, s.orElseThrow().level());
    assertEquals("（二）再犯。", s.get().text());
    assertEquals(
        "(一)半形括號",
        selector
            .select(ref(SelectionLevel.SUBITEM, 1), List.of(Line.plain("(一)半形括號")))
            .orElseThrow()
            .text());
  }

  @Test
  void outOfRangeOrUnqualifiedSelectsNothing() {
    assertTrue(selector.select(ref(SelectionLevel.ITEM, 7), ARTICLE).isEmpty());
    assertTrue(selector.select(ref(SelectionLevel.CLAUSE, 3), ARTICLE).isEmpty());
    assertTrue(selector.select(ref(null, 1), ARTICLE).isEmpty());
    assertTrue(selector.select(ref(SelectionLevel.ITEM, 1), List.of()).isEmpty());
  }
}

package com.gentoro.lawmcp.citation;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.lawmcp.exception.ConfigException;
import com.gentoro.lawmcp.statute.Line;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReferenceExtractorTest {

  private final ReferenceExtractor extractor = new ReferenceExtractor();

  private List<Reference> extract(String currentId, String... lines) {
    return extractor.extractReferences(
        currentId, Arrays.stream(lines).map(Line::plain).toList());
  }

  @Test
  void readsQualifiedReference() {
    List<Reference> refs = extract("20", "依第十六條第一項規定辦理。");

    assertEquals(1, refs.size());
    Reference ref = refs.get(0);
    assertEquals(ReferenceKind.EXPLICIT, ref.kind());
    assertEquals("16", ref.targetId());
    assertEquals(1, ref.item());
    assertNull(ref.clause());
    assertNull(ref.subitem());
    assertEquals("第十六條第一項", ref.matchedText());
  }

  @Test
  @DisplayName("A qualified citation does not also produce a bare article reference")
  void qualifiedCitationIsNotCountedTwice() {
    List<Reference> refs = extract("20", "第五條第一項及第六條之規定");

    assertEquals(2, refs.size());
    assertEquals(
        new Reference.Identity(ReferenceKind.EXPLICIT, "5", 1, null, null), refs.get(0).identity());
    assertEquals(
        new Reference.Identity(ReferenceKind.EXPLICIT, "6", null, null, null),
        refs.get(1).identity());
  }

  @Test
  void readsClausesAndSubitemsWithAsciiDigits() {
    List<Reference> refs = extract("20", "第12條第3款及第7條第2目");

    assertEquals(2, refs.size());
    assertEquals("12", refs.get(0).targetId());
    assertEquals(3, refs.get(0).clause());
    assertEquals("7", refs.get(1).targetId());
    assertEquals(2, refs.get(1).subitem());
  }

  @Test
  void expandsRangeWithinCap() {
    List<Reference> refs = extract("20", "第三條第一項至第三項");

    assertEquals(3, refs.size());
    for (int i = 0; i < 3; i++) {
      assertEquals("3", refs.get(i).targetId());
      assertEquals(i + 1, refs.get(i).item());
      assertEquals("第三條第一項至第三項", refs.get(i).matchedText());
    }
  }

  @Test
  void expandsClauseRangeUpToItsOwnCap() {
    assertEquals(40, extract("20", "第三條第一款至第四十款").size());
  }

  @Test
  void rangeWiderThanCapKeepsOnlyStart() {
    List<Reference> refs = extract("20", "第三條第一項至第四十一項");

    assertEquals(1, refs.size());
    assertEquals(1, refs.get(0).item());
  }

  @Test
  void invertedRangeKeepsOnlyStart() {
    List<Reference> refs = extract("20", "第三條第五項至第二項");

    assertEquals(1, refs.size());
    assertEquals(5, refs.get(0).item());
  }

  @Test
  void expandsSubitemRangeWithinItsCap() {
    List<Reference> refs = extract("20", "第三條第一目至第五目");

    assertEquals(5, refs.size());
    assertEquals(5, refs.get(4).subitem());
    assertNull(refs.get(4).clause());
    assertEquals(51, extract("20", "第三條第一目至第五十一目").size());
  }

  @Test
  void subitemRangeWiderThanCapKeepsOnlyStart() {
    List<Reference> refs = extract("20", "第三條第二目至第六十二目");

    assertEquals(1, refs.size());
    assertEquals(2, refs.get(0).subitem());
  }

  @Test
  void rangeCapIsConfigurable() {
    ReferenceExtractor narrow =
        new ReferenceExtractor(new CitationSettings(1, 50, 50, 20, 4, Duration.ofSeconds(1)));

    List<Reference> refs =
        narrow.extractReferences("20", List.of(Line.plain("第三條第一項至第三項")));

    assertEquals(1, refs.size());
  }

  @Test
  void resolvesPrecedingArticle() {
    List<Reference> refs = extract("16", "前條第二項之規定，於前條準用之。");

    assertEquals(2, refs.size());
    assertEquals(ReferenceKind.RELATIVE, refs.get(0).kind());
    assertEquals("15", refs.get(0).targetId());
    assertEquals(2, refs.get(0).item());
    assertEquals("15", refs.get(1).targetId());
    assertNull(refs.get(1).item());

    assertEquals("16", extract("16-1", "前條").get(0).targetId());
    assertEquals("1", extract("1", "前條").get(0).targetId());
  }

  @Test
  void precedingArticleWithClauseOrSubitem() {
    List<Reference> refs = extract("16", "前條第二款", "前條第三目");

    assertEquals(2, refs.size());
    assertEquals(
        new Reference.Identity(ReferenceKind.RELATIVE, "15", null, 2, null), refs.get(0).identity());
    assertEquals(
        new Reference.Identity(ReferenceKind.RELATIVE, "15", null, null, 3), refs.get(1).identity());
    assertEquals("前條第三目", refs.get(1).matchedText());
  }

  @Test
  void malformedCurrentIdFailsOnlyWhenPrecedingIsReferenced() {
    assertThrows(ConfigException.class, () -> extract("abc", "前條"));
    assertEquals(1, extract("abc", "第十條").size());
  }

  @Test
  void deduplicatesAcrossLinesKeepingFirstOccurrence() {
    List<Reference> refs = extract("20", "本法第十條", "第10條");

    assertEquals(1, refs.size());
    assertEquals("10", refs.get(0).targetId());
    assertEquals("本法第十條", refs.get(0).matchedText());
  }

  @Test
  void repeatedPhraseOnOneLineYieldsOneReference() {
    List<Reference> refs = extract("20", "第五條第一項，第五條第一項");

    assertEquals(1, refs.size());
    assertEquals(
        new Reference.Identity(ReferenceKind.EXPLICIT, "5", 1, null, null), refs.get(0).identity());
  }

  @Test
  void readsInsertedArticleNumbers() {
    List<Reference> refs = extract("20", "第十六條之一及第16-2條");

    assertEquals(2, refs.size());
    assertEquals("16-1", refs.get(0).targetId());
    assertEquals("16-2", refs.get(1).targetId());
  }

  @Test
  void insertedArticleWithQualifier() {
    List<Reference> refs = extract("20", "第十六條之一第二項");

    assertEquals(1, refs.size());
    assertEquals("16-1", refs.get(0).targetId());
    assertEquals(2, refs.get(0).item());
  }

  @Test
  void zeroIndexIsDiscarded() {
    assertTrue(extract("20", "第五條第零項").isEmpty());
  }

  @Test
  void emptyInput() {
    assertTrue(extractor.extractReferences("1", List.of()).isEmpty());
    assertTrue(extractor.extractReferences("1", null).isEmpty());
    assertTrue(extract("1", "本條無引用。").isEmpty());
  }
}

package com.gentoro.lawmcp.moj;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class LawSearchResultTest {

  private static LawHit hit(String name, String pcode) {
    return new LawHit(name, pcode, "https://law.test/LawClass/LawAll.aspx?pcode=" + pcode);
  }

  private final List<LawHit> hits =
      List.of(hit("民法總則施行法", "B0000002"), hit("民法", "B0000001"), hit("民法債編施行法", "B0000003"));

  @Test
  void exactNameWinsEvenWhenNotFirst() {
    LawSearchResult result = LawSearchResult.classify("民法", hits, 5);

    assertEquals(SearchStatus.EXACT_MATCH, result.status());
    assertEquals("B0000001", result.result().pcode());
    assertTrue(result.suggestions().isEmpty());
  }

  @Test
  void loneHitIsSingleMatch() {
    LawSearchResult result = LawSearchResult.classify("刑", List.of(hit("中華民國刑法", "C0000001")), 5);

    assertEquals(SearchStatus.SINGLE_MATCH, result.status());
    assertTrue(result.status().resolved());
  }

  @Test
  void severalHitsAreTruncatedSuggestions() {
    LawSearchResult result = LawSearchResult.classify("施行法", hits, 2);

    assertEquals(SearchStatus.MULTIPLE_MATCHES, result.status());
    assertFalse(result.status().resolved());
    assertNull(result.result());
    assertEquals(List.of("B0000002", "B0000001"), result.suggestions().stream().map(LawHit::pcode).toList());
  }

  @Test
  void noHits() {
    LawSearchResult result = LawSearchResult.classify("xyz", List.of(), 5);

    assertEquals(SearchStatus.NO_MATCH, result.status());
    assertEquals("no_match", result.status().label());
  }
}

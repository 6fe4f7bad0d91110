package com.gentoro.lawmcp.citation;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.lawmcp.exception.ConfigException;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ArticleIdsTest {

  @Test
  void normalizeKeepsNumericIdsAndConvertsNumerals() {
    assertEquals(Optional.of("16-1"), ArticleIds.normalize("16-1"));
    assertEquals(Optional.of("12"), ArticleIds.normalize("12"));
    assertEquals(Optional.of("16"), ArticleIds.normalize("十六"));
    assertEquals(Optional.of("105"), ArticleIds.normalize("一百零五"));
    assertTrue(ArticleIds.normalize("第十條").isEmpty());
    assertTrue(ArticleIds.normalize("").isEmpty());
  }

  @Test
  void precedingArticle() {
    assertEquals("16", ArticleIds.preceding("16-1"));
    assertEquals("15", ArticleIds.preceding("16-0"));
    assertEquals("15", ArticleIds.preceding("16"));
    assertEquals("1", ArticleIds.preceding("1"));
    assertEquals("1", ArticleIds.preceding("2"));
  }

  @Test
  void precedingRejectsMalformedIds() {
    assertThrows(ConfigException.class, () -> ArticleIds.preceding("abc"));
    assertThrows(ConfigException.class, () -> ArticleIds.preceding(null));
    assertThrows(ConfigException.class, () -> ArticleIds.preceding("16-"));
  }
}

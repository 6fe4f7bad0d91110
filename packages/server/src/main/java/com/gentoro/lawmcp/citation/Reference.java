package com.gentoro.lawmcp.citation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

/**
 * A cross reference found in article text. At most one of {@code item}, {@code clause} and {@code
 * subitem} is set; none is set for a reference to a whole article.
 *
 * @param targetId normalized article number of the target
 * @param matchedText the text span the reference was read from
 */
public record Reference(
    ReferenceKind kind,
    String targetId,
    Integer item,
    Integer clause,
    Integer subitem,
    String matchedText) {

  public Reference {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(targetId, "targetId");
    int qualifiers = (item != null ? 1 : 0) + (clause != null ? 1 : 0) + (subitem != null ? 1 : 0);
    if (qualifiers > 1) {
      throw new IllegalArgumentException("At most one of item, clause, subitem may be set");
    }
  }

  /** A reference to {@code targetId}, qualified at {@code level} when it is not null. */
  public static Reference of(
      ReferenceKind kind, String targetId, SelectionLevel level, Integer index, String text) {
    if (level == null || index == null) {
      return new Reference(kind, targetId, null, null, null, text);
    }
    return switch (level) {
      case ITEM -> new Reference(kind, targetId, index, null, null, text);
      case CLAUSE -> new Reference(kind, targetId, null, index, null, text);
      case SUBITEM -> new Reference(kind, targetId, null, null, index, text);
    };
  }

  /** Deduplication key; two references with the same identity point at the same text. */
  @JsonIgnore
  public Identity identity() {
    return new Identity(kind, targetId, item, clause, subitem);
  }

  public record Identity(
      ReferenceKind kind, String targetId, Integer item, Integer clause, Integer subitem) {}
}

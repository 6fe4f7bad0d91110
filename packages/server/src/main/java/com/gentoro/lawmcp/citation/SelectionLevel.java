package com.gentoro.lawmcp.citation;

import com.fasterxml.jackson.annotation.JsonValue;

/** Structural unit inside an article, from coarsest to finest. */
public enum SelectionLevel {
  /** 項 (paragraph) */
  ITEM("item", '項'),
  /** 款 (subparagraph) */
  CLAUSE("clause", '款'),
  /** 目 (item of a subparagraph) */
  SUBITEM("subitem", '目');

  private final String label;
  private final char marker;

  SelectionLevel(String label, char marker) {
    this.label = label;
    this.marker = marker;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /** The character that names this level in statute text. */
  public char marker() {
    return marker;
  }

  public static SelectionLevel ofMarker(String marker) {
    if (marker != null && marker.length() == 1) {
      for (SelectionLevel level : values()) {
        if (level.marker == marker.charAt(0)) {
          return level;
        }
      }
    }
    return null;
  }
}

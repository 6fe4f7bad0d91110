package com.gentoro.lawmcp.citation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReferenceKind {
  /** Names its target: 第十二條第一項. */
  EXPLICIT("explicit"),
  /** Points at the article before the current one: 前條, 前條第二項. */
  RELATIVE("relative");

  private final String label;

  ReferenceKind(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}

package com.gentoro.lawmcp.moj;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SearchStatus {
  EXACT_MATCH("exact_match"),
  SINGLE_MATCH("single_match"),
  MULTIPLE_MATCHES("multiple_matches"),
  NO_MATCH("no_match");

  private final String label;

  SearchStatus(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /** True when the search identified one law. */
  public boolean resolved() {
    return this == EXACT_MATCH || this == SINGLE_MATCH;
  }
}

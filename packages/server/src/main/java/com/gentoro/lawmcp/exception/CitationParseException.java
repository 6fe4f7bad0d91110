package com.gentoro.lawmcp.exception;

import java.util.Map;

/**
 * A numeral or a captured citation fragment could not be understood. Only the candidate match that
 * produced it is discarded; parsing carries on with the rest of the text.
 */
public class CitationParseException extends LawMcpException {
  public CitationParseException(String message, String input) {
    super(LawMcpErrorCode.CITATION_PARSE_ERROR, message, Map.of("input", String.valueOf(input)));
  }

  public CitationParseException(String message, String input, Throwable cause) {
    super(
        LawMcpErrorCode.CITATION_PARSE_ERROR,
        message,
        Map.of("input", String.valueOf(input)),
        cause);
  }

  public String getInput() {
    return (String) getContext().get("input");
  }
}

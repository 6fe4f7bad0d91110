package com.gentoro.lawmcp.exception;

/**
 * The content root or container of a law page is missing, so nothing can be structured. Fatal to
 * the whole document; no partial output is produced.
 */
public class StructuralException extends LawMcpException {
  public StructuralException(String message) {
    super(LawMcpErrorCode.STRUCTURAL_ERROR, message);
  }

  public StructuralException(String message, Throwable cause) {
    super(LawMcpErrorCode.STRUCTURAL_ERROR, message, cause);
  }
}

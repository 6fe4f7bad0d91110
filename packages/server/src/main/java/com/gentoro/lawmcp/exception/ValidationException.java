package com.gentoro.lawmcp.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends LawMcpException {
  public ValidationException(String message) {
    super(LawMcpErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(LawMcpErrorCode.INVALID_ARGUMENT, message, cause);
  }
}

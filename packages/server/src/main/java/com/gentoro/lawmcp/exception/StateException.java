package com.gentoro.lawmcp.exception;

/** Component used before it was initialized, or after it was shut down. */
public class StateException extends LawMcpException {
  public StateException(String message) {
    super(LawMcpErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(LawMcpErrorCode.FAILED_PRECONDITION, message, cause);
  }
}

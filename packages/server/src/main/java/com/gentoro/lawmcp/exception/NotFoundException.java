package com.gentoro.lawmcp.exception;

/** A law or article that was asked for does not exist. */
public class NotFoundException extends LawMcpException {
  public NotFoundException(String message) {
    super(LawMcpErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(LawMcpErrorCode.NOT_FOUND, message, cause);
  }
}

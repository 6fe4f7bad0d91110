package com.gentoro.lawmcp.exception;

/** Local file could not be read or written. */
public class IoException extends LawMcpException {
  public IoException(String message) {
    super(LawMcpErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(LawMcpErrorCode.IO_ERROR, message, cause);
  }
}

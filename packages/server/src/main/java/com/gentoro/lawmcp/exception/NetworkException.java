package com.gentoro.lawmcp.exception;

/** Network-level communication error (HTTP, sockets, timeouts). */
public class NetworkException extends LawMcpException {
  public NetworkException(String message) {
    super(LawMcpErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(LawMcpErrorCode.NETWORK_ERROR, message, cause);
  }
}

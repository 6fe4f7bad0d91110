package com.gentoro.lawmcp.exception;

/** Failure while converting objects to or from JSON/YAML. */
public class SerializationException extends LawMcpException {
  public SerializationException(String message) {
    super(LawMcpErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(LawMcpErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}

package com.gentoro.lawmcp.exception;

/** Configuration problem, or an argument that makes a whole operation meaningless. */
public class ConfigException extends LawMcpException {
  public ConfigException(String message) {
    super(LawMcpErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(LawMcpErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}

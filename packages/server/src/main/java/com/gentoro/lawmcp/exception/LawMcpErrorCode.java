package com.gentoro.lawmcp.exception;

/**
 * Canonical error codes for the law service. Codes are stable and suitable for tool responses and
 * logs. Prefer the most specific code that reflects where the failure originated.
 */
public enum LawMcpErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,

  // Domain specific
  STRUCTURAL_ERROR,
  CITATION_PARSE_ERROR,
  FETCH_ERROR,
}

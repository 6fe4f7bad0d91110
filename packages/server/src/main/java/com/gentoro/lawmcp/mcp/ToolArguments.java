package com.gentoro.lawmcp.mcp;

import com.gentoro.lawmcp.exception.ValidationException;
import java.util.Collections;
import java.util.Map;

/** Typed access to the arguments of a tool call. JSON numbers may arrive as any {@link Number}. */
final class ToolArguments {
  private final Map<String, Object> args;

  ToolArguments(Map<String, Object> args) {
    this.args = args == null ? Collections.emptyMap() : args;
  }

  String requiredString(String name) {
    String value = optionalString(name);
    if (value == null) {
      throw new ValidationException("Missing required argument: " + name);
    }
    return value;
  }

  /** Null when absent or blank. */
  String optionalString(String name) {
    Object value = args.get(name);
    if (value == null) return null;
    String s = value.toString().trim();
    return s.isEmpty() ? null : s;
  }

  Integer optionalInt(String name) {
    Object value = args.get(name);
    if (value == null) return null;
    if (value instanceof Number n) {
      if (n.doubleValue() != Math.rint(n.doubleValue())) {
        throw new ValidationException("Argument " + name + " must be an integer, got " + value);
      }
      return n.intValue();
    }
    try {
      return Integer.parseInt(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new ValidationException("Argument " + name + " must be an integer, got " + value, e);
    }
  }

  Boolean optionalBoolean(String name) {
    Object value = args.get(name);
    if (value == null) return null;
    if (value instanceof Boolean b) return b;
    String s = value.toString().trim();
    if (s.equalsIgnoreCase("true")) return Boolean.TRUE;
    if (s.equalsIgnoreCase("false")) return Boolean.FALSE;
    throw new ValidationException("Argument " + name + " must be a boolean, got " + value);
  }
}

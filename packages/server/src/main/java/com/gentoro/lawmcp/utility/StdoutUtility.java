package com.gentoro.lawmcp.utility;

import com.gentoro.lawmcp.exception.ExceptionUtil;
import java.io.PrintStream;

public class StdoutUtility {
  private static final String green = "\u001B[32m";
  private static final String red = "\u001B[31m";
  private static final String reset = "\u001B[0m";

  public static void printSuccessLine(PrintStream out, String message) {
    for (String line : message.split("\n")) {
      out.printf("%s%s%s%n", green, line, reset);
    }
  }

  public static void printError(PrintStream out, String message, Throwable cause) {
    out.printf("%s%s%s%n", red, message, reset);
    if (cause != null) {
      out.printf("  %s%s%s%n", red, ExceptionUtil.describe(cause), reset);
      out.printf("  %s%s%s%n", red, ExceptionUtil.formatCompactStackTrace(cause, 5), reset);
    }
  }
}

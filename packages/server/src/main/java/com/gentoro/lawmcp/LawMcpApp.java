package com.gentoro.lawmcp;

import com.gentoro.lawmcp.utility.StdoutUtility;

public class LawMcpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.lawmcp.logging.LoggingService.getLogger(LawMcpApp.class);

  public static void main(String[] args) {
    LawMcp app;
    try {
      app = new LawMcp(args);
    } catch (IllegalArgumentException e) {
      StdoutUtility.printError(System.err, e.getMessage(), null);
      System.err.println(StartupParameters.usage());
      System.exit(2);
      return;
    }

    try {
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed", e);
      StdoutUtility.printError(System.err, "law-mcp failed", e);
      app.shutdown();
      System.exit(1);
    }
  }
}

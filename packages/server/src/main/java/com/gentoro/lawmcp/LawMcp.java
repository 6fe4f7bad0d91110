package com.gentoro.lawmcp;

import com.gentoro.lawmcp.actuator.ActuatorService;
import com.gentoro.lawmcp.exception.IoException;
import com.gentoro.lawmcp.exception.StateException;
import com.gentoro.lawmcp.exception.ValidationException;
import com.gentoro.lawmcp.http.EmbeddedJettyServer;
import com.gentoro.lawmcp.mcp.McpServer;
import com.gentoro.lawmcp.moj.MojLawClient;
import com.gentoro.lawmcp.service.ArticleReferences;
import com.gentoro.lawmcp.service.LawQueryService;
import com.gentoro.lawmcp.utility.JacksonUtility;
import com.gentoro.lawmcp.utility.StdoutUtility;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/** Application context: owns configuration, the laws database client, and the HTTP server. */
public class LawMcp {

  private static final org.slf4j.Logger log =
      com.gentoro.lawmcp.logging.LoggingService.getLogger(LawMcp.class);

  private final StartupParameters startupParameters;
  private final PrintStream out;
  private ConfigurationProvider configurationProvider;
  private MojLawClient lawClient;
  private LawQueryService lawService;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public LawMcp(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs), System.out);
  }

  public LawMcp(StartupParameters startupParameters, PrintStream out) {
    this.startupParameters = startupParameters;
    this.out = out;
  }

  /** Loads configuration and runs the selected mode. Returns once the mode is set up or done. */
  public void initialize() {
    if ("help".equals(startupParameters.mode())) {
      out.println(StartupParameters.usage());
      return;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.lawmcp.logging.LoggingService.applyConfiguration(configuration());
    this.lawClient = new MojLawClient(configuration());
    this.lawService = new LawQueryService(lawClient, configuration());

    switch (startupParameters.mode()) {
      case "server" -> startServer();
      case "refs" -> printReferences();
      default ->
          throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
    }
  }

  private void startServer() {
    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new ActuatorService(this).register();
      this.mcpServer = new McpServer(this);
      mcpServer.register();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
  }

  private void printReferences() {
    Integer maxRefs = null;
    String rawMax = startupParameters.getOptionalParameter("max-refs", String.class).orElse(null);
    if (rawMax != null) {
      try {
        maxRefs = Integer.parseInt(rawMax.trim());
      } catch (NumberFormatException e) {
        throw new ValidationException("--max-refs must be an integer, got " + rawMax, e);
      }
    }

    ArticleReferences result =
        lawService.articleReferences(
            startupParameters.getOptionalParameter("pcode", String.class).orElse(null),
            startupParameters.getOptionalParameter("name", String.class).orElse(null),
            startupParameters.getParameter("flno", String.class),
            maxRefs);
    String json = JacksonUtility.toJson(result);

    String target = startupParameters.getOptionalParameter("out", String.class).orElse(null);
    if (target == null || target.isBlank()) {
      out.println(json);
      return;
    }
    Path path = Path.of(target);
    try {
      Files.writeString(path, json, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Could not write " + path.toAbsolutePath(), e);
    }
    StdoutUtility.printSuccessLine(
        out, "Wrote %d references to %s".formatted(result.referenceCount(), path));
  }

  /** Block until the JVM is asked to stop, then release resources. */
  public void waitShutdownSignal() {
    if (httpServer == null) {
      return;
    }
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "law-mcp-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        close(mcpServer);
        close(httpServer);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void close(AutoCloseable closeable) {
    if (closeable == null) return;
    try {
      closeable.close();
    } catch (Exception e) {
      log.warn("Error while closing {}", closeable.getClass().getSimpleName(), e);
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("LawMcp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public MojLawClient lawClient() {
    return lawClient;
  }

  public LawQueryService lawService() {
    return lawService;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}

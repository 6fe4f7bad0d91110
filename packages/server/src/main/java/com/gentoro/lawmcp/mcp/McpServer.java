package com.gentoro.lawmcp.mcp;

import com.gentoro.lawmcp.LawMcp;
import com.gentoro.lawmcp.utility.JacksonUtility;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Exposes {@link LawTools} over the MCP Streamable HTTP transport, mounted on the shared Jetty
 * context.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) servlet path; default "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean) reject HTTP DELETE; default false
 *   <li><b>http.mcp.server.name</b> (string) server name reported to clients; default "law-mcp"
 *   <li><b>http.mcp.server.version</b> (string) reported version; default "0.1.0"
 * </ul>
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.lawmcp.logging.LoggingService.getLogger(McpServer.class);

  private final LawMcp lawMcp;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(LawMcp lawMcp) {
    this.lawMcp = lawMcp;
  }

  /** Register the MCP servlet on the shared Jetty context without managing its lifecycle. */
  public void register() {
    Configuration cfg = lawMcp.configuration();
    String endpoint = normalizeEndpoint(cfg.getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = cfg.getBoolean("http.mcp.disallow-delete", false);
    String serverName = cfg.getString("http.mcp.server.name", "law-mcp");
    String serverVersion = cfg.getString("http.mcp.server.version", "0.1.0");

    var json = new JacksonMcpJsonMapper(JacksonUtility.getJsonMapper().copy());
    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(json)
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    var tools = new LawTools(lawMcp.lawService()).specifications();
    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName, serverVersion)
            .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
            .tools(tools)
            .build();

    lawMcp
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(servletTransport), endpoint);

    log.info(
        "MCP servlet with {} tools registered at http://localhost:{}{}",
        tools.size(),
        lawMcp.httpServer().getPort(),
        endpoint);
  }

  @Override
  public void close() {
    if (mcpServer != null) {
      try {
        mcpServer.closeGracefully();
      } finally {
        mcpServer = null;
      }
    }
    if (servletTransport != null) {
      try {
        servletTransport.destroy();
      } finally {
        servletTransport = null;
      }
    }
  }

  static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    String trimmed = endpoint.trim();
    return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
  }
}

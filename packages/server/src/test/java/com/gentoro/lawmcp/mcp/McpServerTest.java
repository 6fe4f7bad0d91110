package com.gentoro.lawmcp.mcp;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.gentoro.lawmcp.LawMcp;
import com.gentoro.lawmcp.StartupParameters;
import com.gentoro.lawmcp.http.EmbeddedJettyServer;
import com.gentoro.lawmcp.service.LawQueryService;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;

class McpServerTest {

  static class TestMcp extends LawMcp {
    private final Configuration cfg;
    private final EmbeddedJettyServer server;
    private final LawQueryService service = mock(LawQueryService.class);

    TestMcp(Configuration cfg) {
      super(new StartupParameters(new String[0]), System.out);
      this.cfg = cfg;
      this.server = new EmbeddedJettyServer(cfg);
    }

    @Override
    public Configuration configuration() {
      return cfg;
    }

    @Override
    public EmbeddedJettyServer httpServer() {
      return server;
    }

    @Override
    public LawQueryService lawService() {
      return service;
    }
  }

  @Test
  void normalizesEndpoint() {
    assertEquals("/mcp", McpServer.normalizeEndpoint(null));
    assertEquals("/mcp", McpServer.normalizeEndpoint("  "));
    assertEquals("/laws", McpServer.normalizeEndpoint("laws"));
    assertEquals("/laws", McpServer.normalizeEndpoint(" /laws "));
  }

  @Test
  void mountsServletOnConfiguredEndpoint() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("http.hostname", "127.0.0.1");
    cfg.setProperty("http.port", 0);
    cfg.setProperty("http.mcp.endpoint", "law-tools");
    TestMcp mcp = new TestMcp(cfg);
    mcp.httpServer().prepare();

    try (McpServer server = new McpServer(mcp)) {
      server.register();

      assertNotNull(
          mcp.httpServer().getContextHandler().getServletHandler().getServletMapping("/law-tools"));
    } finally {
      mcp.httpServer().close();
    }
  }
}

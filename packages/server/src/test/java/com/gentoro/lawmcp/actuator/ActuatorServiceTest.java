package com.gentoro.lawmcp.actuator;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.lawmcp.LawMcp;
import com.gentoro.lawmcp.StartupParameters;
import com.gentoro.lawmcp.http.EmbeddedJettyServer;
import com.gentoro.lawmcp.utility.JacksonUtility;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ActuatorServiceTest {

  static class TestMcp extends LawMcp {
    private final Configuration cfg;
    private final EmbeddedJettyServer server;

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
  }

  private TestMcp mcp;

  @BeforeEach
  void setUp() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("http.hostname", "127.0.0.1");
    cfg.setProperty("http.port", 0);
    cfg.setProperty("law.base-url", "https://law.test/");
    mcp = new TestMcp(cfg);
    mcp.httpServer().prepare();
  }

  @AfterEach
  void tearDown() {
    mcp.httpServer().close();
  }

  @Test
  void healthEndpointReportsUpAndUpstream() throws Exception {
    new ActuatorService(mcp).register();
    mcp.httpServer().start();

    int port = mcp.httpServer().getPort();
    assertTrue(port > 0);
    Request request =
        new Request.Builder().url("http://127.0.0.1:" + port + "/actuator/health").get().build();
    try (Response response = new OkHttpClient().newCall(request).execute()) {
      assertEquals(200, response.code());
      assertTrue(response.header("Content-Type").startsWith("application/json"));
      JsonNode body = JacksonUtility.getJsonMapper().readTree(response.body().string());
      assertEquals("UP", body.get("status").asText());
      assertEquals("https://law.test/", body.get("upstream").asText());
    }
  }

  @Test
  void unknownPathIsNotFound() throws Exception {
    new ActuatorService(mcp).register();
    mcp.httpServer().start();

    Request request =
        new Request.Builder()
            .url("http://127.0.0.1:" + mcp.httpServer().getPort() + "/nothing")
            .get()
            .build();
    try (Response response = new OkHttpClient().newCall(request).execute()) {
      assertEquals(404, response.code());
    }
  }
}

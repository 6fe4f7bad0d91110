package com.gentoro.lawmcp.actuator;

import com.gentoro.lawmcp.LawMcp;
import com.gentoro.lawmcp.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health endpoint at {@code /actuator/health}.
 *
 * <p>Response body: {@code {"status":"UP","upstream":"https://law.moj.gov.tw/"}}. The laws database
 * is not checked.
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.lawmcp.logging.LoggingService.getLogger(ActuatorService.class);

  private final LawMcp lawMcp;

  public ActuatorService(LawMcp lawMcp) {
    this.lawMcp = lawMcp;
  }

  public void register() {
    String upstream = lawMcp.configuration().getString("law.base-url", "https://law.moj.gov.tw/");
    lawMcp
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(new HealthServlet(upstream)), "/actuator/health");
    log.info("Actuator health endpoint registered at /actuator/health");
  }

  static class HealthServlet extends HttpServlet {
    private final String payload;

    HealthServlet(String upstream) {
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("status", "UP");
      body.put("upstream", upstream);
      this.payload = JacksonUtility.toJson(body);
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      resp.setCharacterEncoding("UTF-8");
      try (PrintWriter out = resp.getWriter()) {
        out.println(payload);
      }
    }
  }
}

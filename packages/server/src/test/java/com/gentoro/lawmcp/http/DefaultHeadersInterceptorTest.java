package com.gentoro.lawmcp.http;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.Test;

class DefaultHeadersInterceptorTest {

  private final List<Request> seen = new ArrayList<>();

  private OkHttpClient client(String userAgent, String referer) {
    return new OkHttpClient.Builder()
        .addInterceptor(new DefaultHeadersInterceptor(userAgent, referer))
        .addInterceptor(
            chain -> {
              seen.add(chain.request());
              return new Response.Builder()
                  .request(chain.request())
                  .protocol(Protocol.HTTP_1_1)
                  .code(200)
                  .message("OK")
                  .body(ResponseBody.create("", MediaType.get("text/plain")))
                  .build();
            })
        .build();
  }

  @Test
  void addsBrowserHeaders() throws Exception {
    client("agent/1.0", "https://law.test/")
        .newCall(new Request.Builder().url("https://law.test/x").build())
        .execute()
        .close();

    Request sent = seen.get(0);
    assertEquals("agent/1.0", sent.header("User-Agent"));
    assertEquals(DefaultHeadersInterceptor.ACCEPT, sent.header("Accept"));
    assertEquals("https://law.test/", sent.header("Referer"));
  }

  @Test
  void keepsHeadersSetByCaller() throws Exception {
    client("agent/1.0", " ")
        .newCall(
            new Request.Builder()
                .url("https://law.test/x")
                .header("User-Agent", "custom")
                .header("Accept", "text/html")
                .build())
        .execute()
        .close();

    Request sent = seen.get(0);
    assertEquals("custom", sent.header("User-Agent"));
    assertEquals("text/html", sent.header("Accept"));
    assertNull(sent.header("Referer"));
  }
}

package com.gentoro.lawmcp.http;

import java.io.IOException;
import okhttp3.*;
import org.jetbrains.annotations.NotNull;

/** Adds the browser-like headers the laws database expects, unless a request sets its own. */
public class DefaultHeadersInterceptor implements Interceptor {
  static final String ACCEPT =
      "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

  private final String userAgent;
  private final String referer;

  public DefaultHeadersInterceptor(String userAgent, String referer) {
    this.userAgent = userAgent;
    this.referer = referer;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    Request.Builder builder = original.newBuilder();
    if (original.header("User-Agent") == null && userAgent != null) {
      builder.header("User-Agent", userAgent);
    }
    if (original.header("Accept") == null) {
      builder.header("Accept", ACCEPT);
    }
    if (original.header("Referer") == null && referer != null && !referer.isBlank()) {
      builder.header("Referer", referer);
    }
    return chain.proceed(builder.build());
  }
}

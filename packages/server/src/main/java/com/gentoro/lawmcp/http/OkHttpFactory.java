package com.gentoro.lawmcp.http;

import java.util.concurrent.TimeUnit;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

public class OkHttpFactory {
  static final String DEFAULT_USER_AGENT = "Mozilla/5.0";

  public static OkHttpClient create(Configuration cfg) {
    return builder(cfg).build();
  }

  /**
   * Builder preloaded with timeouts, browser-like headers and request logging. Tests add their own
   * interceptor to stub responses.
   */
  public static OkHttpClient.Builder builder(Configuration cfg) {
    long connectTimeout = cfg == null ? 10 : cfg.getLong("law.http.connect-timeout-seconds", 10);
    long readTimeout = cfg == null ? 20 : cfg.getLong("law.http.read-timeout-seconds", 20);
    String userAgent =
        cfg == null ? DEFAULT_USER_AGENT : cfg.getString("law.http.user-agent", DEFAULT_USER_AGENT);
    String referer = cfg == null ? null : cfg.getString("law.base-url", null);
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout, TimeUnit.SECONDS)
        .readTimeout(readTimeout, TimeUnit.SECONDS)
        .followRedirects(true)
        .addInterceptor(new DefaultHeadersInterceptor(userAgent, referer))
        .addInterceptor(new LoggingInterceptor());
  }

  public static OkHttpClient create(Configuration cfg, Interceptor extra) {
    return builder(cfg).addInterceptor(extra).build();
  }
}

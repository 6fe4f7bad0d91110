package com.gentoro.lawmcp.http;

import java.io.IOException;
import okhttp3.*;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.lawmcp.logging.LoggingService.getLogger(LoggingInterceptor.class);

  // law pages run to hundreds of kilobytes
  private static final long MAX_LOGGED_BODY = 4096;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug("-> {} {}", request.method(), request.url());
      log.trace("Request headers:\n{}Body:\n{}", request.headers(), bodyToString(request));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      log.debug("<- {} {} failed: {}", request.method(), request.url(), e.toString());
      throw e;
    }

    log.debug(
        "<- {} {} in {} ms",
        response.code(),
        response.request().url(),
        String.format("%.1f", (System.nanoTime() - startTime) / 1e6d));

    if (log.isTraceEnabled()) {
      ResponseBody peek = response.peekBody(MAX_LOGGED_BODY);
      log.trace("Response headers:\n{}Body (first {} bytes):\n{}", response.headers(), MAX_LOGGED_BODY, peek.string());
    }
    return response;
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body: " + e.getMessage() + ")";
    }
  }
}

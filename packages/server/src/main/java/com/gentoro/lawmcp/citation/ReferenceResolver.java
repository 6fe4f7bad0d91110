package com.gentoro.lawmcp.citation;

import com.gentoro.lawmcp.exception.ConfigException;
import com.gentoro.lawmcp.exception.ExceptionUtil;
import com.gentoro.lawmcp.exception.FetchException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches the target of each reference and picks the cited text out of it.
 *
 * <p>Fetches run on a short-lived pool of {@code min(budget, fetchParallelism)} threads. Each fetch
 * has its own timeout, counted from the moment a thread picks it up. A failed or timed out fetch is
 * recorded on its own result and never affects the others. Results come back in input order.
 */
public class ReferenceResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.lawmcp.logging.LoggingService.getLogger(ReferenceResolver.class);

  private static final AtomicInteger POOL_SEQ = new AtomicInteger();

  private final CitationSettings settings;
  private final SubUnitSelector selector;

  public ReferenceResolver() {
    this(CitationSettings.DEFAULTS);
  }

  public ReferenceResolver(CitationSettings settings) {
    this(settings, new SubUnitSelector());
  }

  ReferenceResolver(CitationSettings settings, SubUnitSelector selector) {
    this.settings = settings == null ? CitationSettings.DEFAULTS : settings;
    this.selector = Objects.requireNonNull(selector, "selector");
  }

  /** Resolves with the configured default budget. */
  public List<ResolvedReference> resolve(
      String lawId, List<Reference> references, ArticleFetcher fetcher) {
    return resolve(lawId, references, fetcher, settings.maxRefs());
  }

  /**
   * @param budget maximum number of references processed; the rest are dropped
   * @throws ConfigException when {@code budget} is not positive
   */
  public List<ResolvedReference> resolve(
      String lawId, List<Reference> references, ArticleFetcher fetcher, int budget) {
    if (budget <= 0) {
      throw new ConfigException("Reference budget must be > 0, got " + budget);
    }
    Objects.requireNonNull(fetcher, "fetcher");
    if (references == null || references.isEmpty()) {
      return List.of();
    }

    List<Reference> work = references;
    if (references.size() > budget) {
      log.info(
          "Law {}: {} references found, resolving the first {}",
          lawId,
          references.size(),
          budget);
      work = references.subList(0, budget);
    }

    ResolvedReference[] slots = new ResolvedReference[work.size()];
    int threads = Math.min(work.size(), settings.fetchParallelism());
    ExecutorService pool = Executors.newFixedThreadPool(threads, threadFactory());
    try {
      CompletableFuture<?>[] futures = new CompletableFuture<?>[work.size()];
      for (int i = 0; i < work.size(); i++) {
        final int slot = i;
        final Reference ref = work.get(i);
        CompletableFuture<RawArticleContent> fetched = new CompletableFuture<>();
        pool.execute(() -> fetch(lawId, ref, fetcher, fetched));
        futures[i] =
            fetched.handle(
                (content, error) -> {
                  slots[slot] =
                      error == null
                          ? select(ref, content)
                          : ResolvedReference.failed(ref, describe(lawId, ref, error));
                  return null;
                });
      }
      CompletableFuture.allOf(futures).join();
    } finally {
      pool.shutdownNow();
    }

    long failed = Arrays.stream(slots).filter(ResolvedReference::hasError).count();
    log.debug("Law {}: resolved {} references, {} failed", lawId, slots.length, failed);
    return List.of(slots);
  }

  private void fetch(
      String lawId, Reference ref, ArticleFetcher fetcher, CompletableFuture<RawArticleContent> out) {
    out.orTimeout(settings.fetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
    try {
      out.complete(fetcher.fetch(lawId, ref.targetId()));
    } catch (RuntimeException e) {
      out.completeExceptionally(e);
    }
  }

  private ResolvedReference select(Reference ref, RawArticleContent content) {
    if (content == null) {
      return ResolvedReference.failed(ref, "No content returned for article " + ref.targetId());
    }
    Optional<SubUnitSelector.Selection> selection = selector.select(ref, content.lines());
    return selection
        .map(s -> ResolvedReference.selected(ref, content, s.level(), s.text()))
        .orElseGet(() -> ResolvedReference.wholeArticle(ref, content));
  }

  private String describe(String lawId, Reference ref, Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null
        ? error.getCause()
        : error;
    if (cause instanceof TimeoutException) {
      log.warn("Fetching article {} of {} timed out", ref.targetId(), lawId);
      return "Timed out after " + settings.fetchTimeout().toMillis() + " ms";
    }
    if (cause instanceof FetchException) {
      log.warn("Fetching article {} of {} failed: {}", ref.targetId(), lawId, cause.getMessage());
    } else {
      log.warn("Unexpected error fetching article {} of {}", ref.targetId(), lawId, cause);
    }
    return ExceptionUtil.describe(cause);
  }

  private static ThreadFactory threadFactory() {
    int pool = POOL_SEQ.incrementAndGet();
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "ref-fetch-" + pool + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}

package com.gentoro.lawmcp.citation;

import com.gentoro.lawmcp.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Tuning knobs of the citation engine.
 *
 * @param itemRangeCap widest 項 range (end - start) that is expanded
 * @param clauseRangeCap widest 款 range that is expanded
 * @param subitemRangeCap widest 目 range that is expanded
 * @param maxRefs default resolution budget per article
 * @param fetchParallelism upper bound on concurrent fetches per article
 * @param fetchTimeout timeout of a single fetch
 */
public record CitationSettings(
    int itemRangeCap,
    int clauseRangeCap,
    int subitemRangeCap,
    int maxRefs,
    int fetchParallelism,
    Duration fetchTimeout) {

  public static final CitationSettings DEFAULTS =
      new CitationSettings(30, 50, 50, 20, 4, Duration.ofSeconds(25));

  public CitationSettings {
    if (itemRangeCap < 0 || clauseRangeCap < 0 || subitemRangeCap < 0) {
      throw new ConfigException("Range caps must be >= 0");
    }
    if (maxRefs <= 0) {
      throw new ConfigException("citation.max-refs must be > 0, got " + maxRefs);
    }
    if (fetchParallelism <= 0) {
      throw new ConfigException("citation.fetch.parallelism must be > 0, got " + fetchParallelism);
    }
    if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()) {
      throw new ConfigException("citation.fetch.timeout-ms must be > 0");
    }
  }

  public static CitationSettings fromConfiguration(Configuration cfg) {
    if (cfg == null) return DEFAULTS;
    try {
      return new CitationSettings(
          cfg.getInt("citation.range-cap.item", DEFAULTS.itemRangeCap()),
          cfg.getInt("citation.range-cap.clause", DEFAULTS.clauseRangeCap()),
          cfg.getInt("citation.range-cap.subitem", DEFAULTS.subitemRangeCap()),
          cfg.getInt("citation.max-refs", DEFAULTS.maxRefs()),
          cfg.getInt("citation.fetch.parallelism", DEFAULTS.fetchParallelism()),
          Duration.ofMillis(
              cfg.getLong("citation.fetch.timeout-ms", DEFAULTS.fetchTimeout().toMillis())));
    } catch (ConfigException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid citation configuration", e);
    }
  }

  public int rangeCap(SelectionLevel level) {
    return switch (level) {
      case ITEM -> itemRangeCap;
      case CLAUSE -> clauseRangeCap;
      case SUBITEM -> subitemRangeCap;
    };
  }
}

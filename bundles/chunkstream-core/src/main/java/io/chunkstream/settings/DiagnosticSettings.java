/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized diagnostic settings.
 * <p>
 * Diagnostic features are disabled by default and can be enabled via system properties for
 * troubleshooting.
 * <p>
 * <b>Available System Properties:</b>
 * <ul>
 *   <li>{@code chunkstream.debug.cache.stats} - Log cache statistics after every maintenance run</li>
 *   <li>{@code chunkstream.debug.scheduler} - Log every applied chunk group</li>
 * </ul>
 * <p>
 * <b>Example Usage:</b>
 * <pre>{@code
 * java -Dchunkstream.debug.cache.stats=true -jar server.jar
 * }</pre>
 */
public final class DiagnosticSettings {

  private static final Logger LOGGER = LoggerFactory.getLogger(DiagnosticSettings.class);

  /**
   * Enable cache statistics logging.
   * <p>
   * <b>System Property:</b> {@code chunkstream.debug.cache.stats}
   */
  public static final boolean CACHE_STATISTICS = Boolean.getBoolean("chunkstream.debug.cache.stats");

  /**
   * Enable per-group logging in the batch scheduler.
   * <p>
   * <b>Performance Impact:</b> Moderate overhead due to logging.
   * <p>
   * <b>System Property:</b> {@code chunkstream.debug.scheduler}
   */
  public static final boolean SCHEDULER_DEBUG = Boolean.getBoolean("chunkstream.debug.scheduler");

  static {
    if (CACHE_STATISTICS || SCHEDULER_DEBUG) {
      LOGGER.info("ChunkStream Diagnostic Settings Active:");
      if (CACHE_STATISTICS) {
        LOGGER.info("  - Cache statistics ENABLED (chunkstream.debug.cache.stats)");
      }
      if (SCHEDULER_DEBUG) {
        LOGGER.info("  - Scheduler debugging ENABLED (chunkstream.debug.scheduler)");
      }
    }
  }

  public static boolean isCacheStatisticsEnabled() {
    return CACHE_STATISTICS;
  }

  public static boolean isSchedulerDebugEnabled() {
    return SCHEDULER_DEBUG;
  }

  private DiagnosticSettings() {
    throw new AssertionError("Utility class - do not instantiate");
  }
}

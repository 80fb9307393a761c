/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.access;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.chunkstream.batch.SpatialBatchScheduler;
import io.chunkstream.concurrency.ConcurrencySettings;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Settings of a {@link ChunkStreamSession}: cache bounds, background task periods, prefetch radius
 * and the concurrency settings. Configurations are immutable and created through
 * {@link #newBuilder()}. They can be persisted as JSON with {@link #serialize(ChunkStreamConfiguration, Path)}.
 * </p>
 */
public final class ChunkStreamConfiguration {

  public static final int DEFAULT_CACHE_CAPACITY = 512;

  public static final Duration DEFAULT_ENTRY_TTL = Duration.ofSeconds(60);

  public static final Duration DEFAULT_MAINTENANCE_INTERVAL = Duration.ofSeconds(30);

  public static final int DEFAULT_PREFETCH_RADIUS = 3;

  public static final Duration DEFAULT_SAMPLING_INTERVAL = Duration.ofSeconds(5);

  private final int cacheCapacity;

  private final Duration entryTtl;

  private final Duration maintenanceInterval;

  private final int prefetchRadius;

  private final Duration samplingInterval;

  private final int maxDerivedPasses;

  private final ConcurrencySettings concurrencySettings;

  private ChunkStreamConfiguration(final Builder builder) {
    cacheCapacity = builder.cacheCapacity;
    entryTtl = requireNonNull(builder.entryTtl);
    maintenanceInterval = requireNonNull(builder.maintenanceInterval);
    prefetchRadius = builder.prefetchRadius;
    samplingInterval = requireNonNull(builder.samplingInterval);
    maxDerivedPasses = builder.maxDerivedPasses;
    concurrencySettings = builder.concurrencySettings == null
        ? ConcurrencySettings.newBuilder().build()
        : builder.concurrencySettings;

    checkArgument(cacheCapacity > 0, "cacheCapacity must be positive: %s", cacheCapacity);
    checkArgument(!entryTtl.isNegative(), "entryTtl must not be negative: %s", entryTtl);
    checkArgument(isPositive(maintenanceInterval), "maintenanceInterval must be positive: %s", maintenanceInterval);
    checkArgument(prefetchRadius >= 0, "prefetchRadius must not be negative: %s", prefetchRadius);
    checkArgument(isPositive(samplingInterval), "samplingInterval must be positive: %s", samplingInterval);
    checkArgument(maxDerivedPasses >= 0, "maxDerivedPasses must not be negative: %s", maxDerivedPasses);
  }

  private static boolean isPositive(final Duration duration) {
    return !duration.isNegative() && !duration.isZero();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public int getCacheCapacity() {
    return cacheCapacity;
  }

  public Duration getEntryTtl() {
    return entryTtl;
  }

  public Duration getMaintenanceInterval() {
    return maintenanceInterval;
  }

  public int getPrefetchRadius() {
    return prefetchRadius;
  }

  public Duration getSamplingInterval() {
    return samplingInterval;
  }

  public int getMaxDerivedPasses() {
    return maxDerivedPasses;
  }

  public ConcurrencySettings getConcurrencySettings() {
    return concurrencySettings;
  }

  /**
   * Serialize the configuration.
   *
   * @param config configuration to serialize
   * @param file the file to write, replaced if it exists
   * @throws UncheckedIOException if an I/O error occurs
   */
  public static void serialize(final ChunkStreamConfiguration config, final Path file) {
    try (final Writer fileWriter = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        final JsonWriter jsonWriter = new JsonWriter(fileWriter)) {
      jsonWriter.setIndent("  ");
      jsonWriter.beginObject();
      jsonWriter.name("cacheCapacity").value(config.cacheCapacity);
      jsonWriter.name("entryTtl").value(config.entryTtl.toString());
      jsonWriter.name("maintenanceInterval").value(config.maintenanceInterval.toString());
      jsonWriter.name("prefetchRadius").value(config.prefetchRadius);
      jsonWriter.name("samplingInterval").value(config.samplingInterval.toString());
      jsonWriter.name("maxDerivedPasses").value(config.maxDerivedPasses);

      final ConcurrencySettings settings = config.concurrencySettings;
      jsonWriter.name("concurrency").beginObject();
      jsonWriter.name("minParallelism").value(settings.minParallelism);
      jsonWriter.name("maxParallelism").value(settings.maxParallelism);
      jsonWriter.name("initialLimit").value(settings.initialLimit);
      jsonWriter.name("highCpuThreshold").value(settings.highCpuThreshold);
      jsonWriter.name("highMemoryThreshold").value(settings.highMemoryThreshold);
      jsonWriter.name("lowCpuThreshold").value(settings.lowCpuThreshold);
      jsonWriter.name("lowMemoryThreshold").value(settings.lowMemoryThreshold);
      jsonWriter.name("maxConsecutiveAdjustments").value(settings.maxConsecutiveAdjustments);
      jsonWriter.endObject();

      jsonWriter.endObject();
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Read a configuration written by {@link #serialize(ChunkStreamConfiguration, Path)}. Missing
   * properties keep their defaults, unknown properties are skipped. Durations are ISO-8601 strings
   * such as {@code PT30S}.
   *
   * @param file the file to read
   * @return the configuration
   * @throws UncheckedIOException if an I/O error occurs, the file is malformed or the stored values
   *         are out of range
   */
  public static ChunkStreamConfiguration deserialize(final Path file) {
    try (final Reader fileReader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        final JsonReader jsonReader = new JsonReader(fileReader)) {
      final Builder builder = newBuilder();
      jsonReader.beginObject();
      while (jsonReader.hasNext()) {
        switch (jsonReader.nextName()) {
          case "cacheCapacity" -> builder.cacheCapacity(jsonReader.nextInt());
          case "entryTtl" -> builder.entryTtl(Duration.parse(jsonReader.nextString()));
          case "maintenanceInterval" -> builder.maintenanceInterval(Duration.parse(jsonReader.nextString()));
          case "prefetchRadius" -> builder.prefetchRadius(jsonReader.nextInt());
          case "samplingInterval" -> builder.samplingInterval(Duration.parse(jsonReader.nextString()));
          case "maxDerivedPasses" -> builder.maxDerivedPasses(jsonReader.nextInt());
          case "concurrency" -> builder.concurrencySettings(readConcurrencySettings(jsonReader));
          default -> jsonReader.skipValue();
        }
      }
      jsonReader.endObject();
      return builder.build();
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    } catch (final IllegalStateException | IllegalArgumentException | ArithmeticException | DateTimeException e) {
      throw new UncheckedIOException(new IOException("Malformed configuration file " + file, e));
    }
  }

  private static ConcurrencySettings readConcurrencySettings(final JsonReader jsonReader) throws IOException {
    final ConcurrencySettings.Builder builder = ConcurrencySettings.newBuilder();
    jsonReader.beginObject();
    while (jsonReader.hasNext()) {
      switch (jsonReader.nextName()) {
        case "minParallelism" -> builder.minParallelism(jsonReader.nextInt());
        case "maxParallelism" -> builder.maxParallelism(jsonReader.nextInt());
        case "initialLimit" -> builder.initialLimit(jsonReader.nextInt());
        case "highCpuThreshold" -> builder.highCpuThreshold(jsonReader.nextDouble());
        case "highMemoryThreshold" -> builder.highMemoryThreshold(jsonReader.nextDouble());
        case "lowCpuThreshold" -> builder.lowCpuThreshold(jsonReader.nextDouble());
        case "lowMemoryThreshold" -> builder.lowMemoryThreshold(jsonReader.nextDouble());
        case "maxConsecutiveAdjustments" -> builder.maxConsecutiveAdjustments(jsonReader.nextInt());
        default -> jsonReader.skipValue();
      }
    }
    jsonReader.endObject();
    return builder.build();
  }

  @Override
  public boolean equals(final @Nullable Object obj) {
    if (!(obj instanceof ChunkStreamConfiguration other)) {
      return false;
    }
    return cacheCapacity == other.cacheCapacity && prefetchRadius == other.prefetchRadius
        && maxDerivedPasses == other.maxDerivedPasses && entryTtl.equals(other.entryTtl)
        && maintenanceInterval.equals(other.maintenanceInterval) && samplingInterval.equals(other.samplingInterval)
        && concurrencySettings.equals(other.concurrencySettings);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(cacheCapacity, entryTtl, maintenanceInterval, prefetchRadius, samplingInterval,
        maxDerivedPasses, concurrencySettings);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("cacheCapacity", cacheCapacity)
                      .add("entryTtl", entryTtl)
                      .add("maintenanceInterval", maintenanceInterval)
                      .add("prefetchRadius", prefetchRadius)
                      .add("samplingInterval", samplingInterval)
                      .add("maxDerivedPasses", maxDerivedPasses)
                      .add("concurrencySettings", concurrencySettings)
                      .toString();
  }

  /**
   * Builder for {@link ChunkStreamConfiguration}.
   */
  public static final class Builder {
    private int cacheCapacity = DEFAULT_CACHE_CAPACITY;
    private Duration entryTtl = DEFAULT_ENTRY_TTL;
    private Duration maintenanceInterval = DEFAULT_MAINTENANCE_INTERVAL;
    private int prefetchRadius = DEFAULT_PREFETCH_RADIUS;
    private Duration samplingInterval = DEFAULT_SAMPLING_INTERVAL;
    private int maxDerivedPasses = SpatialBatchScheduler.DEFAULT_MAX_DERIVED_PASSES;
    private @Nullable ConcurrencySettings concurrencySettings;

    private Builder() {
    }

    /**
     * Set the maximum number of cached chunks.
     *
     * @param cacheCapacity the capacity
     * @return this builder instance
     */
    public Builder cacheCapacity(final int cacheCapacity) {
      this.cacheCapacity = cacheCapacity;
      return this;
    }

    public Builder entryTtl(final Duration entryTtl) {
      this.entryTtl = requireNonNull(entryTtl);
      return this;
    }

    public Builder maintenanceInterval(final Duration maintenanceInterval) {
      this.maintenanceInterval = requireNonNull(maintenanceInterval);
      return this;
    }

    public Builder prefetchRadius(final int prefetchRadius) {
      this.prefetchRadius = prefetchRadius;
      return this;
    }

    public Builder samplingInterval(final Duration samplingInterval) {
      this.samplingInterval = requireNonNull(samplingInterval);
      return this;
    }

    /**
     * Set how many derived passes {@code settle} runs at most.
     *
     * @param maxDerivedPasses the pass cap
     * @return this builder instance
     */
    public Builder maxDerivedPasses(final int maxDerivedPasses) {
      this.maxDerivedPasses = maxDerivedPasses;
      return this;
    }

    public Builder concurrencySettings(final ConcurrencySettings concurrencySettings) {
      this.concurrencySettings = requireNonNull(concurrencySettings);
      return this;
    }

    /**
     * Build the configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if a value is out of range
     */
    public ChunkStreamConfiguration build() {
      return new ChunkStreamConfiguration(this);
    }
  }
}

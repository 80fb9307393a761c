/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.access;

import io.chunkstream.concurrency.ConcurrencySettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChunkStreamConfigurationTest {

  @TempDir
  Path tempDir;

  @Test
  void testDefaults() {
    final ChunkStreamConfiguration config = ChunkStreamConfiguration.newBuilder().build();

    assertEquals(512, config.getCacheCapacity());
    assertEquals(Duration.ofSeconds(60), config.getEntryTtl());
    assertEquals(Duration.ofSeconds(30), config.getMaintenanceInterval());
    assertEquals(3, config.getPrefetchRadius());
    assertEquals(Duration.ofSeconds(5), config.getSamplingInterval());
    assertEquals(4, config.getMaxDerivedPasses());
    assertEquals(ConcurrencySettings.newBuilder().build(), config.getConcurrencySettings());
  }

  @Test
  void testSerializeAndDeserialize() {
    final ChunkStreamConfiguration config = ChunkStreamConfiguration.newBuilder()
                                                                    .cacheCapacity(64)
                                                                    .entryTtl(Duration.ofMinutes(2))
                                                                    .prefetchRadius(5)
                                                                    .maxDerivedPasses(2)
                                                                    .concurrencySettings(ConcurrencySettings.newBuilder()
                                                                                                            .maxParallelism(6)
                                                                                                            .highCpuThreshold(0.9)
                                                                                                            .build())
                                                                    .build();
    final Path file = tempDir.resolve("chunkstream.json");

    ChunkStreamConfiguration.serialize(config, file);

    assertEquals(config, ChunkStreamConfiguration.deserialize(file));
  }

  @Test
  void testSubMillisecondDurationsSurviveSerialization() {
    final ChunkStreamConfiguration config = ChunkStreamConfiguration.newBuilder()
                                                                    .maintenanceInterval(Duration.ofNanos(500_000))
                                                                    .samplingInterval(Duration.ofNanos(1))
                                                                    .build();
    final Path file = tempDir.resolve("fast.json");

    ChunkStreamConfiguration.serialize(config, file);
    final ChunkStreamConfiguration read = ChunkStreamConfiguration.deserialize(file);

    assertEquals(Duration.ofNanos(500_000), read.getMaintenanceInterval());
    assertEquals(config, read);
  }

  @Test
  void testMalformedValuesAreReportedAsUncheckedIOException() throws IOException {
    for (final String json : List.of("{\"cacheCapacity\": 1.5}", "{\"cacheCapacity\": 0}",
        "{\"entryTtl\": \"ten minutes\"}", "{\"samplingInterval\": \"PT0S\"}",
        "{\"concurrency\": {\"minParallelism\": 8, \"maxParallelism\": 2}}")) {
      final Path file = tempDir.resolve("malformed.json");
      Files.writeString(file, json, StandardCharsets.UTF_8);

      assertThrows(UncheckedIOException.class, () -> ChunkStreamConfiguration.deserialize(file), json);
    }
  }

  @Test
  void testMissingPropertiesKeepDefaults() throws IOException {
    final Path file = tempDir.resolve("partial.json");
    Files.writeString(file, "{\"cacheCapacity\": 10, \"unknown\": [1, 2]}", StandardCharsets.UTF_8);

    final ChunkStreamConfiguration config = ChunkStreamConfiguration.deserialize(file);

    assertEquals(10, config.getCacheCapacity());
    assertEquals(ChunkStreamConfiguration.DEFAULT_ENTRY_TTL, config.getEntryTtl());
  }

  @Test
  void testInvalidInput() throws IOException {
    assertThrows(UncheckedIOException.class, () -> ChunkStreamConfiguration.deserialize(tempDir.resolve("missing")));

    final Path file = tempDir.resolve("broken.json");
    Files.writeString(file, "[]", StandardCharsets.UTF_8);
    assertThrows(UncheckedIOException.class, () -> ChunkStreamConfiguration.deserialize(file));

    assertThrows(IllegalArgumentException.class, () -> ChunkStreamConfiguration.newBuilder().cacheCapacity(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> ChunkStreamConfiguration.newBuilder().samplingInterval(Duration.ZERO).build());
  }
}

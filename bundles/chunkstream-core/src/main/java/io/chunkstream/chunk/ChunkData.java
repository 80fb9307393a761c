/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.chunk;

import com.google.common.base.MoreObjects;
import io.chunkstream.batch.BlockPosition;
import io.chunkstream.cache.ChunkKey;
import org.checkerframework.checker.index.qual.NonNegative;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Mutable block column of one chunk. Blocks are addressed by local coordinates, an index is
 * {@code x + z * 16 + y * 256}.
 * <p>
 * Instances are not thread safe. Cached instances are treated as read only, updates are applied to
 * a {@link #copy()} which replaces the cached instance afterwards.
 */
public final class ChunkData {

  public static final int SIZE = ChunkKey.CHUNK_SIZE;

  public static final int HEIGHT = BlockPosition.WORLD_HEIGHT;

  public static final int VOLUME = SIZE * SIZE * HEIGHT;

  /**
   * Accumulated movement of an entity inside the chunk.
   */
  public record EntityOffset(double dx, double dy, double dz) {
    public static final EntityOffset ZERO = new EntityOffset(0, 0, 0);

    public EntityOffset plus(final double dx, final double dy, final double dz) {
      return new EntityOffset(this.dx + dx, this.dy + dy, this.dz + dz);
    }
  }

  private final ChunkKey key;

  private final short[] blocks;

  private final byte[] metadata;

  private final Set<BlockPosition> lightDirty;

  private final Set<BlockPosition> pendingTicks;

  private final Map<Long, EntityOffset> entityOffsets;

  /**
   * Create an empty chunk filled with {@link Blocks#AIR}.
   *
   * @param key the chunk key
   */
  public ChunkData(final ChunkKey key) {
    this(requireNonNull(key), new short[VOLUME], new byte[VOLUME], new HashSet<>(), new HashSet<>(), new HashMap<>());
  }

  private ChunkData(final ChunkKey key, final short[] blocks, final byte[] metadata, final Set<BlockPosition> lightDirty,
      final Set<BlockPosition> pendingTicks, final Map<Long, EntityOffset> entityOffsets) {
    this.key = key;
    this.blocks = blocks;
    this.metadata = metadata;
    this.lightDirty = lightDirty;
    this.pendingTicks = pendingTicks;
    this.entityOffsets = entityOffsets;
  }

  /**
   * Create a chunk with a flat terrain: stone up to {@code height - 2}, dirt below the surface and
   * grass on top.
   *
   * @param key the chunk key
   * @param height number of solid layers
   * @return the chunk
   */
  public static ChunkData flat(final ChunkKey key, @NonNegative final int height) {
    checkArgument(height >= 0 && height <= HEIGHT, "Height out of range: %s", height);
    final ChunkData chunk = new ChunkData(key);
    for (int y = 0; y < height; y++) {
      final int blockId = y == height - 1 ? Blocks.GRASS : y >= height - 3 ? Blocks.DIRT : Blocks.STONE;
      Arrays.fill(chunk.blocks, y * SIZE * SIZE, (y + 1) * SIZE * SIZE, (short) blockId);
    }
    return chunk;
  }

  public static int index(final int x, final int y, final int z) {
    checkArgument(x >= 0 && x < SIZE, "Local x out of range: %s", x);
    checkArgument(z >= 0 && z < SIZE, "Local z out of range: %s", z);
    checkArgument(y >= 0 && y < HEIGHT, "y out of range: %s", y);
    return x + z * SIZE + y * SIZE * SIZE;
  }

  /**
   * Create a deep copy.
   *
   * @return the copy
   */
  public ChunkData copy() {
    return new ChunkData(key, blocks.clone(), metadata.clone(), new HashSet<>(lightDirty), new HashSet<>(pendingTicks),
        new HashMap<>(entityOffsets));
  }

  public ChunkKey key() {
    return key;
  }

  public int getBlock(final int x, final int y, final int z) {
    return blocks[index(x, y, z)];
  }

  public int getMetadata(final int x, final int y, final int z) {
    return metadata[index(x, y, z)] & 0xFF;
  }

  public void setBlock(final int x, final int y, final int z, final int blockId, final int meta) {
    checkArgument(blockId >= 0 && blockId <= Short.MAX_VALUE, "Block id out of range: %s", blockId);
    checkArgument(meta >= 0 && meta <= 0xFF, "Metadata out of range: %s", meta);
    final int index = index(x, y, z);
    blocks[index] = (short) blockId;
    metadata[index] = (byte) meta;
  }

  public void markLightDirty(final BlockPosition position) {
    lightDirty.add(requireNonNull(position));
  }

  public boolean isLightDirty(final BlockPosition position) {
    return lightDirty.contains(position);
  }

  public Set<BlockPosition> lightDirtyPositions() {
    return Collections.unmodifiableSet(lightDirty);
  }

  public void scheduleTick(final BlockPosition position) {
    pendingTicks.add(requireNonNull(position));
  }

  public boolean hasPendingTick(final BlockPosition position) {
    return pendingTicks.contains(position);
  }

  public Set<BlockPosition> pendingTickPositions() {
    return Collections.unmodifiableSet(pendingTicks);
  }

  /**
   * Accumulate the movement of an entity.
   *
   * @param entityId the entity
   * @param dx movement along x
   * @param dy movement along y
   * @param dz movement along z
   */
  public void moveEntity(final long entityId, final double dx, final double dy, final double dz) {
    entityOffsets.merge(entityId, EntityOffset.ZERO.plus(dx, dy, dz),
        (current, delta) -> current.plus(delta.dx(), delta.dy(), delta.dz()));
  }

  public EntityOffset entityOffset(final long entityId) {
    return entityOffsets.getOrDefault(entityId, EntityOffset.ZERO);
  }

  /**
   * Count the blocks which are not {@link Blocks#AIR}.
   *
   * @return number of non-air blocks
   */
  public int countNonAir() {
    int count = 0;
    for (final short block : blocks) {
      if (block != Blocks.AIR) {
        count++;
      }
    }
    return count;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("key", key)
                      .add("nonAir", countNonAir())
                      .add("lightDirty", lightDirty.size())
                      .add("pendingTicks", pendingTicks.size())
                      .add("entities", entityOffsets.size())
                      .toString();
  }
}

/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.chunk;

import io.chunkstream.batch.LightPolicy;

/**
 * Block id palette.
 */
public final class Blocks {

  public static final int AIR = 0;
  public static final int STONE = 1;
  public static final int DIRT = 2;
  public static final int GRASS = 3;
  public static final int COBBLESTONE = 4;
  public static final int WOOD = 5;
  public static final int SAND = 6;
  public static final int GRAVEL = 7;
  public static final int WATER = 8;
  public static final int LAVA = 9;
  public static final int GLASS = 10;

  /** Every block except the transparent water and glass changes light propagation. */
  public static final LightPolicy LIGHT_POLICY = blockId -> blockId != WATER && blockId != GLASS;

  private Blocks() {
    throw new AssertionError();
  }
}

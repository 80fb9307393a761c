/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.batch;

/**
 * Decides whether placing a block requires a lighting recalculation.
 */
@FunctionalInterface
public interface LightPolicy {

  boolean affectsLight(int blockId);
}

/*
 * Copyright (c) 2024, ChunkStream Contributors
 *
 * All rights reserved.
 */

package io.chunkstream.exception;

/**
 * Exception to hold all relevant failures upcoming from the chunk streaming layer.
 */
public class ChunkStreamException extends Exception {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  /**
   * Constructor to encapsulate a cause.
   *
   * @param throwable to encapsulate
   */
  public ChunkStreamException(final Throwable throwable) {
    super(throwable);
  }

  public ChunkStreamException(final String message) {
    super(message);
  }

  public ChunkStreamException(final String message, final Object... args) {
    super(String.format(message, args));
  }

  /**
   * Constructor.
   *
   * @param message message as string
   * @param throwable the cause
   */
  public ChunkStreamException(final String message, final Throwable throwable) {
    super(message, throwable);
  }

  public ChunkStreamException(final Throwable cause, final String message, final Object... args) {
    super(String.format(message, args), cause);
  }
}

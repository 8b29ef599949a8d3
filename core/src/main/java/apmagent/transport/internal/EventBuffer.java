/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.internal;

import java.io.IOException;
import okio.Buffer;
import okio.BufferedSink;
import okio.GzipSink;
import okio.Okio;

/**
 * Gzip-compressed, newline-delimited bytes of one batch. The first line is always the metadata
 * record passed to {@link #open(byte[], int, long)}.
 *
 * <p>This type is not thread-safe. Callers write under a lock they share with whatever detaches
 * the buffer for sending, and never touch it again after {@link #close()}.
 */
public final class EventBuffer {
  static final int MIN_LEVEL = 0, MAX_LEVEL = 9;

  /**
   * Opens a new buffer and writes the metadata line into it.
   *
   * @param metadataLine encoded metadata record, without a trailing newline
   * @param compressionLevel gzip level, clamped to 0-9
   * @param createdNanos monotonic time the buffer was opened
   */
  public static EventBuffer open(byte[] metadataLine, int compressionLevel, long createdNanos) {
    if (metadataLine == null) throw new NullPointerException("metadataLine == null");
    EventBuffer result = new EventBuffer(clampLevel(compressionLevel), createdNanos);
    result.write(metadataLine);
    return result;
  }

  public static int clampLevel(int compressionLevel) {
    return Math.min(MAX_LEVEL, Math.max(MIN_LEVEL, compressionLevel));
  }

  final int compressionLevel;
  final long createdNanos;
  final Buffer compressed = new Buffer();
  final BufferedSink sink;
  long uncompressedBytes;
  int lineCount;
  boolean closed;

  EventBuffer(int compressionLevel, long createdNanos) {
    this.compressionLevel = compressionLevel;
    this.createdNanos = createdNanos;
    GzipSink gzip = new GzipSink(compressed);
    gzip.deflater().setLevel(compressionLevel); // before the first deflate, so it applies
    this.sink = Okio.buffer(gzip);
  }

  /** Appends the line followed by '\n'. */
  public void write(byte[] line) {
    if (closed) throw new IllegalStateException("closed");
    try {
      sink.write(line);
      sink.writeByte('\n');
      // push full segments through the deflater, so that compressedBytes() moves
      sink.emitCompleteSegments();
    } catch (IOException e) {
      throw new AssertionError(e); // in-memory buffers don't throw
    }
    uncompressedBytes += line.length + 1;
    lineCount++;
  }

  /**
   * Finishes the gzip stream and returns the complete, compressed batch. Subsequent writes fail.
   */
  public byte[] close() {
    if (closed) throw new IllegalStateException("closed");
    closed = true;
    try {
      sink.close();
    } catch (IOException e) {
      throw new AssertionError(e);
    }
    return compressed.readByteArray();
  }

  /** Compressed bytes produced so far. Lags behind writes as the deflater holds back output. */
  public long compressedBytes() {
    return compressed.size();
  }

  public long uncompressedBytes() {
    return uncompressedBytes;
  }

  /** Count of lines written, including the metadata line. */
  public int lineCount() {
    return lineCount;
  }

  public int compressionLevel() {
    return compressionLevel;
  }

  public long createdNanos() {
    return createdNanos;
  }

  public boolean isClosed() {
    return closed;
  }

  @Override public String toString() {
    return "EventBuffer{lines=" + lineCount + ", compressedBytes=" + compressed.size() + "}";
  }
}

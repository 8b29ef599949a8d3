/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

/**
 * Utility for encoding one type of event into a byte array, suitable for appending to a batch.
 *
 * @param <E> type of the event, usually {@link Event}
 */
public interface BytesEncoder<E> {
  /** Serializes an object into its binary form. */
  byte[] encode(E input);
}

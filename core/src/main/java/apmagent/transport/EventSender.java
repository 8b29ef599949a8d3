/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import java.io.Closeable;
import java.util.Map;

/**
 * Delivers a finished batch to a collector, usually with an HTTP POST. This is the only place
 * network I/O happens.
 *
 * <p>Calls to {@link #send(byte[], Map, int)} block until the collector responded or the timeout
 * elapsed. A {@link Transport} makes those calls on its dispatch worker, unless configured to send
 * synchronously. Implementations must be safe to call from different threads, though not
 * necessarily concurrently.
 *
 * <p>The output of {@link #toString()} ends up in logs, so it should summarize the destination
 * without leaking credentials.
 */
public interface EventSender extends Closeable {
  /**
   * Sends one batch as a single request.
   *
   * @param body gzip-compressed NDJSON, first line metadata
   * @param headers request headers to add, such as "Authorization"
   * @param timeoutMillis maximum time to wait for the whole call, 0 for none
   * @return the "Location" of the accepted batch, or null if the collector didn't say
   * @throws TransportException if the batch was not accepted
   * @throws ClosedSenderException if {@link #close()} was called
   */
  String send(byte[] body, Map<String, String> headers, int timeoutMillis)
    throws TransportException;

  /** Releases resources. Further calls to {@link #send} fail. */
  @Override void close();
}

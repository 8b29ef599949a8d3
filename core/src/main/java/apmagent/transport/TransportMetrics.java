/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

/**
 * Instrumented applications queue events into a {@link Transport}, which ships them in batches to
 * an APM collector.
 *
 * <p>Callbacks on this type are invoked by the transport to improve the visibility of the agent
 * itself. A typical implementation will report metrics to a telemetry system for analysis.
 *
 * <h3>Key Relationships</h3>
 *
 * <ul>
 * <li>{@link #updateBufferedEvents Buffered events}. Alert when this stays high, as the time or
 * size trigger may be misconfigured.</li>
 * <li>Dropped events. Alert when this increases, as it could indicate the collector is down or
 * rate limiting.</li>
 * <li>Successful messages = {@link #incrementMessages() Attempted messages} -
 * {@link #incrementMessagesDropped Dropped messages}.</li>
 * </ul>
 */
public interface TransportMetrics {

  /** Increments count of batches handed to the sender. Ex POST requests. */
  void incrementMessages();

  /**
   * Increments count of batches that could not be sent. Ex collector unavailable, rate limited or
   * backing off after a prior failure.
   */
  void incrementMessagesDropped(Throwable cause);

  /** Increments the count of events of the given kind queued, excluding metadata records. */
  void incrementEvents(EventKind kind, int quantity);

  /** Increments the number of encoded (uncompressed) event bytes queued. */
  void incrementEventBytes(int quantity);

  /** Increments the number of compressed bytes in batches handed to the sender. */
  void incrementMessageBytes(int quantity);

  /** Increments the count of events dropped, for example after close or when sending failed. */
  void incrementEventsDropped(DropReason reason, int quantity);

  /** Updates the count of events in the open batch. */
  void updateBufferedEvents(int update);

  /** Updates the compressed size of the open batch. */
  void updateBufferedBytes(int update);

  TransportMetrics NOOP_METRICS = new TransportMetrics() {

    @Override public void incrementMessages() {
    }

    @Override public void incrementMessagesDropped(Throwable cause) {
    }

    @Override public void incrementEvents(EventKind kind, int quantity) {
    }

    @Override public void incrementEventBytes(int quantity) {
    }

    @Override public void incrementMessageBytes(int quantity) {
    }

    @Override public void incrementEventsDropped(DropReason reason, int quantity) {
    }

    @Override public void updateBufferedEvents(int update) {
    }

    @Override public void updateBufferedBytes(int update) {
    }

    @Override public String toString() {
      return "NoOpTransportMetrics";
    }
  };
}

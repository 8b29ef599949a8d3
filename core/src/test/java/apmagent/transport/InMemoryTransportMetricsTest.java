/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import java.io.IOException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class InMemoryTransportMetricsTest {
  InMemoryTransportMetrics metrics = new InMemoryTransportMetrics();

  @Test void incrementMessagesDropped_sameExceptionTypeIsCountedOnce() {
    metrics.incrementMessagesDropped(new IOException());
    metrics.incrementMessagesDropped(new IOException());
    metrics.incrementMessagesDropped(new IllegalStateException());

    assertThat(metrics.messagesDropped()).isEqualTo(3);
    assertThat(metrics.messagesDroppedByCause()).containsOnly(
      entry(IOException.class, 2L),
      entry(IllegalStateException.class, 1L)
    );
  }

  @Test void incrementEvents_tallyByKind() {
    metrics.incrementEvents(EventKind.SPAN, 2);
    metrics.incrementEvents(EventKind.TRANSACTION, 1);
    metrics.incrementEvents(EventKind.SPAN, 1);
    metrics.incrementEventBytes(100);

    assertThat(metrics.events()).isEqualTo(4);
    assertThat(metrics.events(EventKind.SPAN)).isEqualTo(3);
    assertThat(metrics.events(EventKind.ERROR)).isZero();
    assertThat(metrics.eventsByKind()).containsExactly(
      entry(EventKind.TRANSACTION, 1L),
      entry(EventKind.SPAN, 3L)
    );
    assertThat(metrics.eventBytes()).isEqualTo(100);
  }

  @Test void incrementEventsDropped_tallyByReason() {
    metrics.incrementEventsDropped(DropReason.DELIVERY, 5);
    metrics.incrementEventsDropped(DropReason.CLOSED, 1);
    metrics.incrementEventsDropped(DropReason.BACKOFF, 0);

    assertThat(metrics.eventsDropped()).isEqualTo(6);
    assertThat(metrics.eventsDropped(DropReason.DELIVERY)).isEqualTo(5);
    assertThat(metrics.eventsDroppedByReason()).containsOnlyKeys(
      DropReason.CLOSED, DropReason.DELIVERY);
  }

  @Test void updateBuffered_replacesValue() {
    metrics.updateBufferedEvents(5);
    metrics.updateBufferedEvents(2);
    metrics.updateBufferedBytes(1024);

    assertThat(metrics.bufferedEvents()).isEqualTo(2);
    assertThat(metrics.bufferedBytes()).isEqualTo(1024);
  }

  @Test void clear() {
    metrics.incrementMessages();
    metrics.incrementMessageBytes(10);
    metrics.incrementEvents(EventKind.ERROR, 1);
    metrics.incrementEventsDropped(DropReason.ENCODING, 1);
    metrics.incrementMessagesDropped(new IOException());
    metrics.updateBufferedEvents(3);
    metrics.clear();

    assertThat(metrics.messages()).isZero();
    assertThat(metrics.messageBytes()).isZero();
    assertThat(metrics.events()).isZero();
    assertThat(metrics.eventsDropped()).isZero();
    assertThat(metrics.messagesDropped()).isZero();
    assertThat(metrics.bufferedEvents()).isZero();
  }
}

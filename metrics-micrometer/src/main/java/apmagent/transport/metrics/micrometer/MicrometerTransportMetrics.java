/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.metrics.micrometer;

import apmagent.transport.DropReason;
import apmagent.transport.EventKind;
import apmagent.transport.TransportException;
import apmagent.transport.TransportMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Implementation of {@link TransportMetrics} with Micrometer.
 *
 * <p>Queued events are tagged with their kind, and dropped events with the reason. Dropped
 * messages are tagged with the simple name of their cause, and for HTTP errors, the status code.
 */
public class MicrometerTransportMetrics implements TransportMetrics {

  private static final String PREFIX = "apm.transport.";

  final MeterRegistry meterRegistry;
  final Iterable<Tag> extraTags;

  final Counter messages;
  final Counter messageBytes;
  final Map<EventKind, Counter> events = new EnumMap<>(EventKind.class);
  final Counter eventBytes;
  final Map<DropReason, Counter> eventsDropped = new EnumMap<>(DropReason.class);
  final AtomicInteger bufferedEvents;
  final AtomicInteger bufferedBytes;

  /**
   * Creates a {@link MicrometerTransportMetrics} instance that registers all metrics to the given
   * {@link MeterRegistry}. To add extra tags, use {@link #builder(MeterRegistry)} instead.
   *
   * @param meterRegistry all metrics will be registered to this registry
   */
  public static MicrometerTransportMetrics create(MeterRegistry meterRegistry) {
    return new Builder(meterRegistry).build();
  }

  public static Builder builder(MeterRegistry meterRegistry) {
    return new Builder(meterRegistry);
  }

  private MicrometerTransportMetrics(MeterRegistry meterRegistry, Tag... extraTags) {
    this.meterRegistry = meterRegistry;
    this.extraTags = Arrays.asList(extraTags);

    messages = Counter.builder(PREFIX + "messages.total")
      .description("Batches posted (or attempted to be posted)")
      .tags(this.extraTags).register(meterRegistry);
    messageBytes = Counter.builder(PREFIX + "messages")
      .description("Total compressed bytes of batches posted")
      .baseUnit("bytes")
      .tags(this.extraTags).register(meterRegistry);
    for (EventKind kind : EventKind.values()) {
      if (kind == EventKind.METADATA) continue; // written per batch, not queued
      events.put(kind, Counter.builder(PREFIX + "events.total")
        .description("Events queued")
        .tags(this.extraTags).tag("kind", kind.wireName())
        .register(meterRegistry));
    }
    eventBytes = Counter.builder(PREFIX + "events")
      .description("Total bytes of serialized events, before compression")
      .baseUnit("bytes")
      .tags(this.extraTags).register(meterRegistry);
    for (DropReason reason : DropReason.values()) {
      eventsDropped.put(reason, Counter.builder(PREFIX + "events.dropped")
        .description("Events dropped, because they could not be encoded or delivered")
        .tags(this.extraTags).tag("reason", reason.name().toLowerCase(Locale.ROOT))
        .register(meterRegistry));
    }
    bufferedEvents = new AtomicInteger();
    Gauge.builder(PREFIX + "buffer.events", bufferedEvents, AtomicInteger::get)
      .description("Events in the open batch")
      .tags(this.extraTags).register(meterRegistry);
    bufferedBytes = new AtomicInteger();
    Gauge.builder(PREFIX + "buffer.bytes", bufferedBytes, AtomicInteger::get)
      .description("Compressed size of the open batch")
      .baseUnit("bytes")
      .tags(this.extraTags).register(meterRegistry);
  }

  @Override
  public void incrementMessages() {
    messages.increment();
  }

  @Override
  public void incrementMessageBytes(int i) {
    messageBytes.increment(i);
  }

  @Override
  public void incrementMessagesDropped(Throwable cause) {
    Tags tags = Tags.concat(extraTags, "cause", cause.getClass().getSimpleName());
    if (cause instanceof TransportException) {
      int status = ((TransportException) cause).statusCode();
      if (status != -1) tags = tags.and("status", String.valueOf(status));
    }
    meterRegistry.counter(PREFIX + "messages.dropped", tags).increment();
  }

  @Override
  public void incrementEvents(EventKind kind, int i) {
    Counter counter = events.get(kind);
    if (counter != null) counter.increment(i);
  }

  @Override
  public void incrementEventBytes(int i) {
    eventBytes.increment(i);
  }

  @Override
  public void incrementEventsDropped(DropReason reason, int i) {
    eventsDropped.get(reason).increment(i);
  }

  @Override
  public void updateBufferedEvents(int i) {
    bufferedEvents.set(i);
  }

  @Override
  public void updateBufferedBytes(int i) {
    bufferedBytes.set(i);
  }

  public static final class Builder {
    final MeterRegistry meterRegistry;
    Tag[] extraTags = new Tag[0];

    Builder(MeterRegistry meterRegistry) {
      if (meterRegistry == null) throw new NullPointerException("meterRegistry == null");
      this.meterRegistry = meterRegistry;
    }

    /**
     * Additional tags to attach to all transport metrics.
     */
    public Builder extraTags(Tag... extraTags) {
      this.extraTags = extraTags;
      return this;
    }

    public MicrometerTransportMetrics build() {
      return new MicrometerTransportMetrics(meterRegistry, extraTags);
    }
  }
}

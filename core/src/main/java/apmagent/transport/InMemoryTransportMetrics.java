/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Keeps transport metrics in memory, tallying events by {@link EventKind}, drops by {@link
 * DropReason} and failed messages by the type of their cause. Useful in tests, or to log a
 * summary when the agent shuts down.
 */
public final class InMemoryTransportMetrics implements TransportMetrics {
  final ConcurrentMap<EventKind, LongAdder> eventsByKind = new ConcurrentHashMap<>();
  final ConcurrentMap<DropReason, LongAdder> eventsDroppedByReason = new ConcurrentHashMap<>();
  final ConcurrentMap<Class<? extends Throwable>, LongAdder> messagesDroppedByCause =
    new ConcurrentHashMap<>();
  final LongAdder messages = new LongAdder(), messageBytes = new LongAdder();
  final LongAdder eventBytes = new LongAdder();
  final AtomicLong bufferedEvents = new AtomicLong(), bufferedBytes = new AtomicLong();

  @Override public void incrementMessages() {
    messages.increment();
  }

  @Override public void incrementMessageBytes(int quantity) {
    messageBytes.add(quantity);
  }

  @Override public void incrementMessagesDropped(Throwable cause) {
    tally(messagesDroppedByCause, cause.getClass(), 1);
  }

  @Override public void incrementEvents(EventKind kind, int quantity) {
    tally(eventsByKind, kind, quantity);
  }

  @Override public void incrementEventBytes(int quantity) {
    eventBytes.add(quantity);
  }

  @Override public void incrementEventsDropped(DropReason reason, int quantity) {
    tally(eventsDroppedByReason, reason, quantity);
  }

  @Override public void updateBufferedEvents(int update) {
    bufferedEvents.set(update);
  }

  @Override public void updateBufferedBytes(int update) {
    bufferedBytes.set(update);
  }

  public long messages() {
    return messages.sum();
  }

  public long messageBytes() {
    return messageBytes.sum();
  }

  public long messagesDropped() {
    return total(messagesDroppedByCause);
  }

  public Map<Class<? extends Throwable>, Long> messagesDroppedByCause() {
    return snapshot(messagesDroppedByCause, new LinkedHashMap<>());
  }

  /** Events queued, of any kind. */
  public long events() {
    return total(eventsByKind);
  }

  public long events(EventKind kind) {
    LongAdder count = eventsByKind.get(kind);
    return count == null ? 0 : count.sum();
  }

  /** Kinds that were never queued are absent. */
  public Map<EventKind, Long> eventsByKind() {
    return snapshot(eventsByKind, new EnumMap<>(EventKind.class));
  }

  public long eventBytes() {
    return eventBytes.sum();
  }

  /** Events dropped, for any reason. */
  public long eventsDropped() {
    return total(eventsDroppedByReason);
  }

  public long eventsDropped(DropReason reason) {
    LongAdder count = eventsDroppedByReason.get(reason);
    return count == null ? 0 : count.sum();
  }

  public Map<DropReason, Long> eventsDroppedByReason() {
    return snapshot(eventsDroppedByReason, new EnumMap<>(DropReason.class));
  }

  public long bufferedEvents() {
    return bufferedEvents.get();
  }

  public long bufferedBytes() {
    return bufferedBytes.get();
  }

  public void clear() {
    eventsByKind.clear();
    eventsDroppedByReason.clear();
    messagesDroppedByCause.clear();
    messages.reset();
    messageBytes.reset();
    eventBytes.reset();
    bufferedEvents.set(0);
    bufferedBytes.set(0);
  }

  @Override public String toString() {
    return "InMemoryTransportMetrics{events=" + eventsByKind() + ", dropped="
      + eventsDroppedByReason() + ", messages=" + messages() + "}";
  }

  static <K> void tally(ConcurrentMap<K, LongAdder> counts, K key, int quantity) {
    if (quantity == 0) return;
    counts.computeIfAbsent(key, k -> new LongAdder()).add(quantity);
  }

  static long total(Map<?, LongAdder> counts) {
    long result = 0L;
    for (LongAdder count : counts.values()) result += count.sum();
    return result;
  }

  static <K> Map<K, Long> snapshot(Map<K, LongAdder> counts, Map<K, Long> result) {
    for (Map.Entry<K, LongAdder> entry : counts.entrySet()) {
      result.put(entry.getKey(), entry.getValue().sum());
    }
    return Collections.unmodifiableMap(result);
  }
}

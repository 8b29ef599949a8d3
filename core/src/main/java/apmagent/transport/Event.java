/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A telemetry record produced by instrumentation: a {@link EventKind kind} and an arbitrary nested
 * payload. Instances are immutable; the payload is copied on construction.
 *
 * <p>Nested values are not copied. Callers should not mutate them after handing the event to a
 * {@link Transport}.
 */
public final class Event {
  public static Event create(EventKind kind, Map<String, ?> payload) {
    return new Event(kind, payload);
  }

  final EventKind kind;
  final Map<String, Object> payload;

  Event(EventKind kind, Map<String, ?> payload) {
    if (kind == null) throw new NullPointerException("kind == null");
    if (payload == null) throw new NullPointerException("payload == null");
    this.kind = kind;
    this.payload = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(payload));
  }

  public EventKind kind() {
    return kind;
  }

  public Map<String, Object> payload() {
    return payload;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Event)) return false;
    Event that = (Event) o;
    return kind == that.kind && payload.equals(that.payload);
  }

  @Override public int hashCode() {
    return 31 * kind.hashCode() + payload.hashCode();
  }

  @Override public String toString() {
    return "Event{" + kind.wireName + "}";
  }
}

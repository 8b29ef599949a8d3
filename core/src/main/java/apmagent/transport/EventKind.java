/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

/** The type tag of an {@link Event}, written as the single key of its NDJSON line. */
public enum EventKind {
  /** Agent and service identity. Always the first line of a batch. */
  METADATA("metadata"),
  TRANSACTION("transaction"),
  SPAN("span"),
  ERROR("error"),
  METRICSET("metricset");

  final String wireName;

  EventKind(String wireName) {
    this.wireName = wireName;
  }

  /** The JSON key this kind is written under, ex. "span". */
  public String wireName() {
    return wireName;
  }
}

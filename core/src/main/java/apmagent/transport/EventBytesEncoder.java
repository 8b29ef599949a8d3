/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import apmagent.transport.internal.JsonValueWriter;

/** Includes built-in formats accepted by the APM Server intake API. */
public enum EventBytesEncoder implements BytesEncoder<Event> {
  /**
   * One single-line JSON object per event, keyed by {@link EventKind#wireName()}. The trailing
   * newline is added by the batch, not the encoder.
   */
  NDJSON {
    @Override public String mediaType() {
      return "application/x-ndjson";
    }

    @Override public byte[] encode(Event input) {
      if (input == null) throw new NullPointerException("input == null");
      return JsonValueWriter.writeSingleKeyObject(input.kind.wireName, input.payload);
    }
  };

  /** Value of the "Content-Type" header of a batch, before compression. */
  public abstract String mediaType();
}

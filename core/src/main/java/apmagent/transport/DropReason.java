/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

/** Why a {@link Transport} discarded events. */
public enum DropReason {
  /** Queued after {@link Transport#close()}. */
  CLOSED,
  /** The payload could not be serialized. */
  ENCODING,
  /** The batch was flushed while backing off after a failed delivery, so it was never sent. */
  BACKOFF,
  /** The batch was sent, but delivery failed. */
  DELIVERY
}

/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.internal;

import apmagent.transport.BackoffStrategy;

/**
 * Online or error state of a transport, used to skip delivery while backing off after failures.
 *
 * <p>Updated from whichever thread delivered the last batch, so methods are synchronized.
 */
public final class TransportState {
  final BackoffStrategy backoff;
  boolean online = true;
  long lastCheckNanos;
  int retryNumber = -1;

  public TransportState(BackoffStrategy backoff) {
    if (backoff == null) throw new NullPointerException("backoff == null");
    this.backoff = backoff;
  }

  /** Returns true when online, or when the back-off since the last failure elapsed. */
  public synchronized boolean shouldTry(long nowNanos) {
    if (online) return true;
    return nowNanos - lastCheckNanos > backoff.backoffNanos(retryNumber);
  }

  public synchronized void setFail(long nowNanos) {
    online = false;
    retryNumber++;
    lastCheckNanos = nowNanos;
  }

  public synchronized void setSuccess() {
    online = true;
    lastCheckNanos = 0L;
    retryNumber = -1;
  }

  public synchronized boolean didFail() {
    return !online;
  }

  public synchronized int retryNumber() {
    return retryNumber;
  }
}

/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import java.io.IOException;

/**
 * Raised by an {@link EventSender} when a batch could not be delivered. Carries the undelivered
 * batch, so callers can log or retry it.
 *
 * <p>{@link #printTrace()} is false for expected conditions, such as rate limiting or timeouts,
 * which should be logged without a stack trace.
 */
public final class TransportException extends IOException {
  static final long serialVersionUID = 0L;

  /** The collector did not answer within the request timeout. */
  public static TransportException timeout(String message, byte[] data, Throwable cause) {
    return new TransportException(message, data, false, -1, true, cause);
  }

  /** The request failed before a response was read, ex. connection refused. */
  public static TransportException unreachable(String message, byte[] data, Throwable cause) {
    return new TransportException(message, data, true, -1, false, cause);
  }

  /** The collector responded with an error status. 429 is not considered noteworthy. */
  public static TransportException httpError(String message, byte[] data, int statusCode) {
    return new TransportException(message, data, statusCode != 429, statusCode, false, null);
  }

  final transient byte[] data;
  final boolean printTrace, timeout;
  final int statusCode;

  TransportException(String message, byte[] data, boolean printTrace, int statusCode,
    boolean timeout, Throwable cause) {
    super(message, cause);
    this.data = data;
    this.printTrace = printTrace;
    this.statusCode = statusCode;
    this.timeout = timeout;
  }

  /** The batch that was not delivered, or null if unknown. */
  public byte[] data() {
    return data;
  }

  /** True if this failure is unexpected enough to log with its stack trace. */
  public boolean printTrace() {
    return printTrace;
  }

  /** HTTP status code of the response, or -1 if none was received. */
  public int statusCode() {
    return statusCode;
  }

  public boolean isRateLimited() {
    return statusCode == 429;
  }

  public boolean isTimeout() {
    return timeout;
  }
}

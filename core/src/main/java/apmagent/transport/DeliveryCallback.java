/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

/**
 * Receives the outcome of each batch a {@link Transport} attempted to deliver. Invoked on the
 * thread that sent the batch, usually the dispatch worker, so implementations must not block.
 */
public interface DeliveryCallback {
  DeliveryCallback NOOP = new DeliveryCallback() {
    @Override public void onSuccess(String location) {
    }

    @Override public void onError(TransportException error) {
    }

    @Override public String toString() {
      return "NoopDeliveryCallback";
    }
  };

  /**
   * Invoked when the collector accepted a batch.
   *
   * @param location value of the "Location" response header, possibly null
   */
  void onSuccess(String location);

  /**
   * Invoked when a batch was dropped because delivery failed. Unchecked failures of the sender,
   * such as {@link ClosedSenderException}, arrive as the {@linkplain Throwable#getCause() cause}.
   */
  void onError(TransportException error);
}

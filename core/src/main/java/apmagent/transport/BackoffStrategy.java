/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import java.util.concurrent.TimeUnit;

/**
 * Decides how long a {@link Transport} drops batches after delivery failed, before it tries the
 * collector again.
 *
 * <p>The retry number is zero after the first consecutive failure, one after the second, and so
 * on. It resets when a delivery succeeds.
 */
public interface BackoffStrategy {
  /** Never back off: every batch is attempted. */
  BackoffStrategy NONE = new BackoffStrategy() {
    @Override public long backoffNanos(int retryNumber) {
      return 0L;
    }

    @Override public String toString() {
      return "NONE";
    }
  };

  /** {@code min(retryNumber, 6)^2} seconds: 0, 1, 4, 9 ... 36. */
  BackoffStrategy QUADRATIC = new BackoffStrategy() {
    @Override public long backoffNanos(int retryNumber) {
      long capped = Math.min(Math.max(retryNumber, 0), 6);
      return TimeUnit.SECONDS.toNanos(capped * capped);
    }

    @Override public String toString() {
      return "QUADRATIC";
    }
  };

  /** {@code 2^min(retryNumber, 6) - 1} seconds: 0, 1, 3, 7 ... 63. */
  BackoffStrategy EXPONENTIAL = new BackoffStrategy() {
    @Override public long backoffNanos(int retryNumber) {
      int capped = Math.min(Math.max(retryNumber, 0), 6);
      return TimeUnit.SECONDS.toNanos((1L << capped) - 1);
    }

    @Override public String toString() {
      return "EXPONENTIAL";
    }
  };

  /** Returns the time to wait since the last failure, before trying again. */
  long backoffNanos(int retryNumber);
}

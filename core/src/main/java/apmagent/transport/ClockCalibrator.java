/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Translates {@link System#nanoTime() monotonic} readings into wall-clock microseconds.
 *
 * <p>The offset between the two clocks drifts, so it is re-derived once older than a time to
 * live (300 seconds by default). Each derivation samples the wall clock between two monotonic
 * readings several times, and keeps the sample with the narrowest bracket.
 */
public final class ClockCalibrator {
  static final long DEFAULT_TTL_NANOS = TimeUnit.SECONDS.toNanos(300);
  static final long DEFAULT_TOLERANCE_NANOS = TimeUnit.MICROSECONDS.toNanos(10);
  static final int DEFAULT_MAX_SAMPLES = 10;

  public static ClockCalibrator create() {
    final Clock clock = Clock.systemUTC();
    return new ClockCalibrator(() -> {
      Instant now = clock.instant();
      return TimeUnit.SECONDS.toMicros(now.getEpochSecond()) + now.getNano() / 1000;
    }, System::nanoTime, DEFAULT_TTL_NANOS, DEFAULT_TOLERANCE_NANOS, DEFAULT_MAX_SAMPLES);
  }

  /** Calibrates using the given clocks. Intended for tests. */
  public static ClockCalibrator create(LongSupplier epochMicros, LongSupplier nanoTime) {
    return new ClockCalibrator(epochMicros, nanoTime, DEFAULT_TTL_NANOS, DEFAULT_TOLERANCE_NANOS,
      DEFAULT_MAX_SAMPLES);
  }

  static final class Calibration {
    final long nanoTime, epochMicros, bracketNanos;

    Calibration(long nanoTime, long epochMicros, long bracketNanos) {
      this.nanoTime = nanoTime;
      this.epochMicros = epochMicros;
      this.bracketNanos = bracketNanos;
    }
  }

  final LongSupplier epochMicros, nanoTime;
  final long ttlNanos, toleranceNanos;
  final int maxSamples;
  volatile Calibration calibration;

  ClockCalibrator(LongSupplier epochMicros, LongSupplier nanoTime, long ttlNanos,
    long toleranceNanos, int maxSamples) {
    if (epochMicros == null) throw new NullPointerException("epochMicros == null");
    if (nanoTime == null) throw new NullPointerException("nanoTime == null");
    if (maxSamples < 1) throw new IllegalArgumentException("maxSamples < 1: " + maxSamples);
    this.epochMicros = epochMicros;
    this.nanoTime = nanoTime;
    this.ttlNanos = ttlNanos;
    this.toleranceNanos = toleranceNanos;
    this.maxSamples = maxSamples;
  }

  /** Reads the monotonic clock. */
  public long nanoTime() {
    return nanoTime.getAsLong();
  }

  /** Current wall-clock time in epoch microseconds, derived from the monotonic clock. */
  public long currentTimeMicros() {
    return toEpochMicros(nanoTime());
  }

  /** Converts a reading of {@link #nanoTime()} into epoch microseconds. */
  public long toEpochMicros(long nanos) {
    Calibration c = current();
    return c.epochMicros + TimeUnit.NANOSECONDS.toMicros(nanos - c.nanoTime);
  }

  Calibration current() {
    Calibration c = calibration;
    if (c == null || nanoTime() - c.nanoTime > ttlNanos) {
      // racing threads may each calibrate, and either result is good
      calibration = c = calibrate();
    }
    return c;
  }

  Calibration calibrate() {
    Calibration best = null;
    for (int i = 0; i < maxSamples; i++) {
      long before = nanoTime();
      long wall = epochMicros.getAsLong();
      long after = nanoTime();
      long bracket = Math.abs(after - before);
      if (best == null || bracket < best.bracketNanos) {
        best = new Calibration(before + (after - before) / 2, wall, bracket);
      }
      if (bracket <= toleranceNanos) break;
    }
    return best;
  }
}

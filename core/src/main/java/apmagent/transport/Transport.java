/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import apmagent.transport.internal.EventBuffer;
import apmagent.transport.internal.TransportState;
import java.io.Closeable;
import java.io.Flushable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import static apmagent.transport.internal.Throwables.propagateIfFatal;

/**
 * Batches events into gzip-compressed NDJSON and hands each batch to an {@link EventSender}.
 *
 * <p>Every batch starts with the metadata record. A batch is flushed when a caller asks for it,
 * when {@link Builder#maxFlushTime(long, TimeUnit) time since the last flush} elapsed, or when the
 * compressed size exceeds {@link Builder#maxBufferSize(int)}. When asynchronous, a daemon timer
 * thread flushes batches that sit idle past the time limit. Application threads only pay for
 * serialization and compression: by default, delivery happens on an {@link AsyncWorker}.
 *
 * <p>Ex.
 * <pre>{@code
 * transport = Transport.newBuilder(URLConnectionSender.create("http://localhost:8200/intake/v2/events"))
 *                      .metadata(metadata)
 *                      .build();
 * transport.queue(EventKind.TRANSACTION, transaction);
 * }</pre>
 */
public final class Transport implements Flushable, Closeable {
  static final Logger logger = Logger.getLogger(Transport.class.getName());

  public enum State {
    /** No events are buffered. */
    EMPTY,
    /** A batch is open and accepting events. */
    OPEN,
    /** A detached batch is being compressed or dispatched. */
    FLUSHING
  }

  public static Builder newBuilder(EventSender sender) {
    return new Builder(sender);
  }

  public static final class Builder {
    final EventSender sender;
    final Map<String, String> headers = new LinkedHashMap<String, String>();
    Map<String, ?> metadata = Collections.emptyMap();
    int compressionLevel = 5;
    long maxFlushTimeNanos = TimeUnit.SECONDS.toNanos(10);
    int maxBufferSize = 768 * 1024;
    long sendTimeoutMillis = TimeUnit.SECONDS.toMillis(20);
    boolean async = true;
    ThreadFactory threadFactory = Executors.defaultThreadFactory();
    TransportMetrics metrics = TransportMetrics.NOOP_METRICS;
    DeliveryCallback callback = DeliveryCallback.NOOP;
    BackoffStrategy backoff = BackoffStrategy.QUADRATIC;
    ClockCalibrator clock;

    Builder(EventSender sender) {
      if (sender == null) throw new NullPointerException("sender == null");
      this.sender = sender;
    }

    /** Written as the first record of every batch. Defaults to an empty object. */
    public Builder metadata(Map<String, ?> metadata) {
      if (metadata == null) throw new NullPointerException("metadata == null");
      this.metadata = metadata;
      return this;
    }

    /** Gzip level, clamped to 0-9. Default 5. */
    public Builder compressionLevel(int compressionLevel) {
      this.compressionLevel = EventBuffer.clampLevel(compressionLevel);
      return this;
    }

    /**
     * Flushes when an event is queued this long after the last flush. When {@link #async(boolean)
     * asynchronous}, a timer also flushes an idle batch after this long, give or take 10% so that
     * agents started together don't flush together. Default 10 seconds. Zero disables time based
     * flushing.
     */
    public Builder maxFlushTime(long maxFlushTime, TimeUnit unit) {
      if (maxFlushTime < 0) throw new IllegalArgumentException("maxFlushTime < 0: " + maxFlushTime);
      if (unit == null) throw new NullPointerException("unit == null");
      this.maxFlushTimeNanos = unit.toNanos(maxFlushTime);
      return this;
    }

    /**
     * Flushes when the compressed size of the open batch exceeds this many bytes. Default 768 KiB.
     * Zero disables size based flushing.
     */
    public Builder maxBufferSize(int maxBufferSize) {
      if (maxBufferSize < 0) throw new IllegalArgumentException("maxBufferSize < 0: " + maxBufferSize);
      this.maxBufferSize = maxBufferSize;
      return this;
    }

    /** Timeout passed to each {@link EventSender#send} call. Default 20 seconds. */
    public Builder sendTimeout(long sendTimeout, TimeUnit unit) {
      if (sendTimeout < 0) throw new IllegalArgumentException("sendTimeout < 0: " + sendTimeout);
      if (unit == null) throw new NullPointerException("unit == null");
      this.sendTimeoutMillis = unit.toMillis(sendTimeout);
      if (sendTimeoutMillis > Integer.MAX_VALUE) {
        throw new IllegalArgumentException("sendTimeout too large: " + sendTimeout + " " + unit);
      }
      return this;
    }

    /** Adds a request header, such as {@code Authorization}. */
    public Builder header(String name, String value) {
      if (name == null) throw new NullPointerException("name == null");
      if (value == null) throw new NullPointerException("value == null");
      headers.put(name, value);
      return this;
    }

    /** When false, flushes send on the calling thread. Default true. */
    public Builder async(boolean async) {
      this.async = async;
      return this;
    }

    /** Creates the thread of the {@link AsyncWorker}. */
    public Builder threadFactory(ThreadFactory threadFactory) {
      if (threadFactory == null) throw new NullPointerException("threadFactory == null");
      this.threadFactory = threadFactory;
      return this;
    }

    public Builder metrics(TransportMetrics metrics) {
      if (metrics == null) throw new NullPointerException("metrics == null");
      this.metrics = metrics;
      return this;
    }

    /** Notified of each delivery outcome, on the thread that sent the batch. */
    public Builder callback(DeliveryCallback callback) {
      if (callback == null) throw new NullPointerException("callback == null");
      this.callback = callback;
      return this;
    }

    /** How long to drop batches after a failed delivery. Default {@link BackoffStrategy#QUADRATIC}. */
    public Builder backoff(BackoffStrategy backoff) {
      if (backoff == null) throw new NullPointerException("backoff == null");
      this.backoff = backoff;
      return this;
    }

    public Builder clock(ClockCalibrator clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    public Transport build() {
      return new Transport(this);
    }
  }

  final EventSender sender;
  final Map<String, String> headers;
  final byte[] metadataLine;
  final int compressionLevel;
  final long maxFlushTimeNanos;
  final int maxBufferSize;
  final int sendTimeoutMillis;
  final boolean async;
  final ThreadFactory threadFactory;
  final TransportMetrics metrics;
  final DeliveryCallback callback;
  final TransportState transportState;
  final ClockCalibrator clock;

  final ReentrantLock lock = new ReentrantLock();
  EventBuffer buffer; // guarded by lock
  final AtomicInteger flushesInProgress = new AtomicInteger();
  final AtomicBoolean closed = new AtomicBoolean();
  final AtomicBoolean timerStarted;
  final CountDownLatch closeSignal = new CountDownLatch(1);
  volatile Thread flushTimer;
  volatile long lastFlushNanos;
  AsyncWorker worker; // guarded by this

  Transport(Builder builder) {
    this.sender = builder.sender;
    Map<String, String> headers = new LinkedHashMap<String, String>();
    headers.put("Content-Type", EventBytesEncoder.NDJSON.mediaType());
    headers.put("Content-Encoding", "gzip");
    headers.putAll(builder.headers);
    this.headers = Collections.unmodifiableMap(headers);
    this.metadataLine =
      EventBytesEncoder.NDJSON.encode(Event.create(EventKind.METADATA, builder.metadata));
    this.compressionLevel = builder.compressionLevel;
    this.maxFlushTimeNanos = builder.maxFlushTimeNanos;
    this.maxBufferSize = builder.maxBufferSize;
    this.sendTimeoutMillis = (int) builder.sendTimeoutMillis;
    this.async = builder.async;
    this.threadFactory = builder.threadFactory;
    this.metrics = builder.metrics;
    this.callback = builder.callback;
    this.transportState = new TransportState(builder.backoff);
    this.clock = builder.clock != null ? builder.clock : ClockCalibrator.create();
    this.lastFlushNanos = clock.nanoTime();
    // pretend we already started when nothing would flush on a timer
    this.timerStarted = new AtomicBoolean(!async || maxFlushTimeNanos == 0);
  }

  void startFlushTimer() {
    Thread timer = threadFactory.newThread(new FlushTimer());
    timer.setName("apm flush timer");
    timer.setDaemon(true);
    flushTimer = timer;
    timer.start();
  }

  /** Scales the interval by a factor between 0.9 and 1.1, given a random number in [0, 1). */
  static long jittered(long intervalNanos, double random) {
    return (long) (intervalNanos * (0.9 + 0.2 * random));
  }

  /** Same as {@code queue(kind, payload, false)}. */
  public void queue(EventKind kind, Map<String, ?> payload) {
    queue(Event.create(kind, payload), false);
  }

  public void queue(EventKind kind, Map<String, ?> payload, boolean flush) {
    queue(Event.create(kind, payload), flush);
  }

  /**
   * Appends the event to the open batch, flushing afterwards when requested or when a time or size
   * limit was crossed. Delivery failures are never thrown to the caller: events that cannot be
   * encoded, or that arrive after {@link #close()}, are dropped.
   */
  public void queue(Event event, boolean flush) {
    if (event == null) throw new NullPointerException("event == null");
    if (closed.get()) {
      logger.fine("Dropping event as transport is closed");
      metrics.incrementEventsDropped(DropReason.CLOSED, 1);
      return;
    }
    // Lazy start so that transports never used don't spawn threads
    if (timerStarted.compareAndSet(false, true)) startFlushTimer();

    byte[] line;
    try {
      line = EventBytesEncoder.NDJSON.encode(event); // outside the lock
    } catch (Throwable t) {
      propagateIfFatal(t);
      logger.log(Level.WARNING, "Dropping " + event + " as it could not be encoded", t);
      metrics.incrementEventsDropped(DropReason.ENCODING, 1);
      return;
    }
    metrics.incrementEvents(event.kind, 1);
    metrics.incrementEventBytes(line.length);

    boolean shouldFlush = flush;
    lock.lock();
    try {
      if (buffer == null) buffer = EventBuffer.open(metadataLine, compressionLevel, clock.nanoTime());
      buffer.write(line);
      metrics.updateBufferedEvents(buffer.lineCount() - 1);
      metrics.updateBufferedBytes((int) Math.min(Integer.MAX_VALUE, buffer.compressedBytes()));

      if (flush) {
        logger.fine("forced flush");
      } else if (maxFlushTimeNanos > 0 && clock.nanoTime() - lastFlushNanos > maxFlushTimeNanos) {
        logger.fine("flushing due to time since last flush");
        shouldFlush = true;
      } else if (maxBufferSize > 0 && buffer.compressedBytes() > maxBufferSize) {
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("flushing since buffer size " + buffer.compressedBytes() + " bytes > "
            + maxBufferSize + " bytes");
        }
        shouldFlush = true;
      }
    } finally {
      lock.unlock();
    }

    if (!shouldFlush) return;
    try {
      flush(false);
    } catch (TransportException | RuntimeException e) {
      // already logged and counted by the delivery path
      logger.log(Level.FINE, "flush triggered by queue failed", e);
    }
  }

  /** Same as {@code flush(false)}. */
  @Override public void flush() throws TransportException {
    flush(false);
  }

  /**
   * Detaches the open batch, finalizes its compression and delivers it. Does nothing when there is
   * no open batch.
   *
   * @param sync when true, sends on the calling thread even when the transport is asynchronous.
   * @throws TransportException when sending on the calling thread failed
   */
  public void flush(boolean sync) throws TransportException {
    EventBuffer detached;
    lock.lock();
    try {
      detached = buffer;
      if (detached == null) return;
      buffer = null;
      flushesInProgress.incrementAndGet();
      metrics.updateBufferedEvents(0);
      metrics.updateBufferedBytes(0);
    } finally {
      lock.unlock();
    }

    try {
      int eventCount = detached.lineCount() - 1;
      byte[] data = detached.close();
      if (sync || !async) {
        lastFlushNanos = clock.nanoTime();
        deliver(data, eventCount, true);
      } else {
        worker().queue(new Delivery(data, eventCount));
        lastFlushNanos = clock.nanoTime();
      }
    } finally {
      flushesInProgress.decrementAndGet();
    }
  }

  void deliver(byte[] data, int eventCount, boolean propagate) throws TransportException {
    if (!transportState.shouldTry(clock.nanoTime())) {
      logger.warning("dropping flushed data due to transport failure back-off");
      metrics.incrementEventsDropped(DropReason.BACKOFF, eventCount);
      return;
    }

    metrics.incrementMessages();
    metrics.incrementMessageBytes(data.length);
    String location;
    try {
      location = sender.send(data, headers, sendTimeoutMillis);
    } catch (TransportException e) {
      transportState.setFail(clock.nanoTime());
      if (e.printTrace()) {
        logger.log(Level.WARNING, "Failed to submit message: " + e.getMessage(), e);
      } else {
        logger.info("Failed to submit message: " + e.getMessage());
      }
      metrics.incrementMessagesDropped(e);
      metrics.incrementEventsDropped(DropReason.DELIVERY, eventCount);
      notifyError(e);
      if (propagate) throw e;
      return;
    } catch (RuntimeException e) {
      transportState.setFail(clock.nanoTime());
      logger.log(Level.WARNING, "Failed to submit message: " + e.getMessage(), e);
      metrics.incrementMessagesDropped(e);
      metrics.incrementEventsDropped(DropReason.DELIVERY, eventCount);
      // such as ClosedSenderException: the callback sees it as the cause
      notifyError(TransportException.unreachable("Unable to send: " + e, data, e));
      if (propagate) throw e;
      return;
    }
    transportState.setSuccess();
    try {
      callback.onSuccess(location);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Error notifying " + callback, e);
    }
  }

  void notifyError(TransportException e) {
    try {
      callback.onError(e);
    } catch (RuntimeException re) {
      logger.log(Level.WARNING, "Error notifying " + callback, re);
    }
  }

  /** Returns the worker that delivers asynchronous flushes, restarting it if it died. */
  public synchronized AsyncWorker worker() {
    if (worker == null) {
      worker = AsyncWorker.newBuilder().threadFactory(threadFactory).build();
    } else if (!worker.isAlive()) {
      worker.start();
    }
    return worker;
  }

  /**
   * Flushes on the calling thread, then waits a bounded time for asynchronous deliveries to drain.
   * Failures are logged, not thrown. Events queued afterwards are dropped.
   */
  @Override public void close() {
    if (!closed.compareAndSet(false, true)) return;
    closeSignal.countDown(); // stops the flush timer
    try {
      flush(true);
    } catch (TransportException | RuntimeException e) {
      logger.log(Level.FINE, "flush on close failed", e);
    }
    AsyncWorker toDrain;
    synchronized (this) {
      toDrain = worker;
    }
    if (toDrain != null) toDrain.mainThreadTerminated();
  }

  public State state() {
    if (flushesInProgress.get() > 0) return State.FLUSHING;
    lock.lock();
    try {
      return buffer == null ? State.EMPTY : State.OPEN;
    } finally {
      lock.unlock();
    }
  }

  /** Compressed size of the open batch, including the metadata record. */
  public long bufferedBytes() {
    lock.lock();
    try {
      return buffer == null ? 0 : buffer.compressedBytes();
    } finally {
      lock.unlock();
    }
  }

  /** Count of events in the open batch, excluding the metadata record. */
  public int bufferedEvents() {
    lock.lock();
    try {
      return buffer == null ? 0 : buffer.lineCount() - 1;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Epoch microseconds of the last flush, or of construction when there was none yet. An idle
   * timer tick that found nothing to send counts as a flush.
   */
  public long lastFlushTimeMicros() {
    return clock.toEpochMicros(lastFlushNanos);
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override public String toString() {
    return "Transport{" + sender + "}";
  }

  final class FlushTimer implements Runnable {
    @Override public void run() {
      long intervalNanos = jittered(maxFlushTimeNanos, ThreadLocalRandom.current().nextDouble());
      while (!closed.get()) {
        long waitNanos = lastFlushNanos + intervalNanos - clock.nanoTime();
        if (waitNanos > 0) {
          try {
            if (closeSignal.await(waitNanos, TimeUnit.NANOSECONDS)) return;
          } catch (InterruptedException e) {
            logger.fine("Interrupted waiting to flush, exiting");
            Thread.currentThread().interrupt();
            return;
          }
          continue; // another flush may have moved the deadline
        }

        logger.fine("flushing due to time since last flush");
        try {
          flush(false);
        } catch (TransportException | RuntimeException e) {
          logger.log(Level.FINE, "flush triggered by timer failed", e);
        }
        // nothing was open, so there was no flush to move the deadline
        if (clock.nanoTime() - lastFlushNanos >= intervalNanos) lastFlushNanos = clock.nanoTime();
        intervalNanos = jittered(maxFlushTimeNanos, ThreadLocalRandom.current().nextDouble());
      }
    }

    @Override public String toString() {
      return "FlushTimer{" + sender + "}";
    }
  }

  final class Delivery implements Runnable {
    final byte[] data;
    final int eventCount;

    Delivery(byte[] data, int eventCount) {
      this.data = data;
      this.eventCount = eventCount;
    }

    @Override public void run() {
      try {
        deliver(data, eventCount, false);
      } catch (TransportException e) {
        throw new AssertionError(e); // unreachable, as propagate is false
      }
    }

    @Override public String toString() {
      return "Delivery{" + eventCount + " events, " + data.length + " bytes}";
    }
  }
}

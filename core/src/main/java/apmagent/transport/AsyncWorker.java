/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport;

import apmagent.transport.internal.JoinableQueue;
import java.io.PrintStream;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import static apmagent.transport.internal.Throwables.propagateIfFatal;

/**
 * Runs deferred tasks, such as sending a batch, on a single background thread. Application threads
 * {@link #queue(Runnable) queue} work without blocking, and never see exceptions it raises.
 *
 * <p>The thread is a daemon, so it does not keep the process alive. Call {@link
 * #mainThreadTerminated()} on the way out to give pending tasks a bounded amount of time to
 * finish.
 */
public final class AsyncWorker {
  static final Logger logger = Logger.getLogger(AsyncWorker.class.getName());

  /** Marks the end of the queue. Compared by identity. */
  static final Runnable TERMINATOR = new Runnable() {
    @Override public void run() {
    }

    @Override public String toString() {
      return "TERMINATOR";
    }
  };

  /** Returns a started worker with default settings. */
  public static AsyncWorker create() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    ThreadFactory threadFactory = Executors.defaultThreadFactory();
    PrintStream console = System.out;
    long initialDrainTimeoutNanos = TimeUnit.MILLISECONDS.toNanos(100);
    long drainTimeoutNanos = TimeUnit.SECONDS.toNanos(10);

    Builder() {
    }

    /** Creates the worker thread, which is then renamed and marked as a daemon. */
    public Builder threadFactory(ThreadFactory threadFactory) {
      if (threadFactory == null) throw new NullPointerException("threadFactory == null");
      this.threadFactory = threadFactory;
      return this;
    }

    /** Where to print the pending message diagnostic on exit. Defaults to {@link System#out}. */
    public Builder console(PrintStream console) {
      if (console == null) throw new NullPointerException("console == null");
      this.console = console;
      return this;
    }

    /**
     * How long {@link #mainThreadTerminated()} waits silently before printing how many messages
     * are pending. Default 100 milliseconds.
     */
    public Builder initialDrainTimeout(long timeout, TimeUnit unit) {
      if (timeout < 0) throw new IllegalArgumentException("initialDrainTimeout < 0: " + timeout);
      if (unit == null) throw new NullPointerException("unit == null");
      this.initialDrainTimeoutNanos = unit.toNanos(timeout);
      return this;
    }

    /**
     * Upper bound of time {@link #mainThreadTerminated()} blocks in total, including the initial
     * timeout. Default 10 seconds.
     */
    public Builder drainTimeout(long timeout, TimeUnit unit) {
      if (timeout < 0) throw new IllegalArgumentException("drainTimeout < 0: " + timeout);
      if (unit == null) throw new NullPointerException("unit == null");
      this.drainTimeoutNanos = unit.toNanos(timeout);
      return this;
    }

    /** Builds and {@link #start() starts} a worker. */
    public AsyncWorker build() {
      AsyncWorker result = new AsyncWorker(this);
      result.start();
      return result;
    }
  }

  final JoinableQueue<Runnable> queue = new JoinableQueue<Runnable>();
  final ThreadFactory threadFactory;
  final PrintStream console;
  final long initialDrainTimeoutNanos, drainTimeoutNanos;
  volatile Thread thread; // written under this, cleared by the thread itself on exit
  // Terminators in the queue, and how many of the oldest ones a later start() revoked.
  int terminatorsQueued, terminatorsRevoked; // guarded by this

  AsyncWorker(Builder builder) {
    this.threadFactory = builder.threadFactory;
    this.console = builder.console;
    this.initialDrainTimeoutNanos = builder.initialDrainTimeoutNanos;
    this.drainTimeoutNanos = Math.max(builder.drainTimeoutNanos, builder.initialDrainTimeoutNanos);
  }

  /**
   * Starts the worker thread, unless one is already running. A pending {@link #stop()} that has not
   * yet reached the thread is revoked, so there is never more than one thread draining the queue.
   */
  public synchronized void start() {
    terminatorsRevoked = terminatorsQueued;
    if (thread != null) return;
    Thread result = threadFactory.newThread(new Drainer());
    result.setName("apm sender thread");
    result.setDaemon(true);
    thread = result;
    result.start();
  }

  /** Schedules the task to run on the worker thread. Never blocks. */
  public void queue(Runnable task) {
    if (task == null) throw new NullPointerException("task == null");
    queue.put(task);
  }

  /** Schedules the callback to run on the worker thread with the given argument. Never blocks. */
  public <T> void queue(final Consumer<T> callback, final T argument) {
    if (callback == null) throw new NullPointerException("callback == null");
    queue(new Runnable() {
      @Override public void run() {
        callback.accept(argument);
      }

      @Override public String toString() {
        return callback.toString();
      }
    });
  }

  /** Stops the worker thread after pending tasks complete, blocking until it exited. */
  public void stop() {
    stop(0, TimeUnit.MILLISECONDS);
  }

  /**
   * Stops the worker thread after pending tasks complete, blocking up to the timeout for it to
   * exit. A timeout of zero waits forever.
   */
  public void stop(long timeout, TimeUnit unit) {
    if (unit == null) throw new NullPointerException("unit == null");
    Thread toJoin = requestStop();
    if (toJoin == null) return;
    try {
      toJoin.join(unit.toMillis(timeout));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Waits a bounded amount of time for queued tasks to finish, because the process is exiting.
   *
   * <p>This waits briefly and silently at first. If tasks are still pending after that, it prints
   * how many to the console, and waits until the drain timeout. Tasks still pending after that are
   * abandoned.
   */
  public void mainThreadTerminated() {
    if (requestStop() == null) return; // not started or already stopped
    try {
      if (queue.join(initialDrainTimeoutNanos, TimeUnit.NANOSECONDS)) return;

      long pid = ProcessHandle.current().pid();
      long remainingNanos = drainTimeoutNanos - initialDrainTimeoutNanos;
      console.printf(Locale.ROOT, "PID %d: APM agent is attempting to send %d pending messages%n",
        pid, pending());
      console.printf(Locale.ROOT, "Waiting up to %s seconds, press Ctrl-C to quit.%n",
        seconds(drainTimeoutNanos));
      long waitStart = System.nanoTime();
      queue.join(remainingNanos, TimeUnit.NANOSECONDS);
      console.printf(Locale.ROOT, "PID %d: done, took %.2f seconds to complete.%n", pid,
        (System.nanoTime() - waitStart) / 1e9);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Queues a terminator unless one is already on its way, returning the thread that will consume
   * it, or null when no thread is running.
   */
  synchronized Thread requestStop() {
    Thread current = thread;
    if (current == null) return null;
    if (terminatorsQueued == terminatorsRevoked) {
      terminatorsQueued++;
      queue.put(TERMINATOR); // wakes the thread up, and ends it once the queue drained
    }
    return current;
  }

  /** Called by the worker thread on each terminator. Returns true if the thread should exit. */
  synchronized boolean consumeTerminator() {
    terminatorsQueued--;
    if (terminatorsRevoked > 0) {
      terminatorsRevoked--;
      return false;
    }
    exited(Thread.currentThread());
    return true;
  }

  synchronized void exited(Thread exiting) {
    if (thread == exiting) thread = null;
  }

  /** Returns true if the worker thread is running. */
  public boolean isAlive() {
    Thread current = thread;
    return current != null && current.isAlive();
  }

  /** Approximate count of tasks not yet picked up by the worker thread. */
  public int pending() {
    int terminators;
    synchronized (this) {
      terminators = terminatorsQueued;
    }
    return Math.max(0, queue.size() - terminators);
  }

  static String seconds(long nanos) {
    long millis = TimeUnit.NANOSECONDS.toMillis(nanos);
    return millis % 1000 == 0 ? String.valueOf(millis / 1000) : String.valueOf(millis / 1000.0);
  }

  @Override public String toString() {
    return "AsyncWorker{pending=" + pending() + "}";
  }

  final class Drainer implements Runnable {
    @Override public void run() {
      try {
        drain();
      } finally {
        exited(Thread.currentThread());
      }
    }

    void drain() {
      while (true) {
        Runnable task;
        try {
          task = queue.take();
        } catch (InterruptedException e) {
          logger.fine("Interrupted waiting for tasks, exiting");
          return;
        }
        try {
          if (task == TERMINATOR) {
            if (consumeTerminator()) return;
            continue;
          }
          task.run();
        } catch (Throwable t) {
          propagateIfFatal(t);
          logger.log(Level.WARNING, "Error while sending", t);
        } finally {
          queue.taskDone();
        }
        Thread.yield();
      }
    }

    @Override public String toString() {
      return "AsyncWorker";
    }
  }
}

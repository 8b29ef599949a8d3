/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package apmagent.transport.internal;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded multi-producer FIFO that tracks unfinished tasks, so a caller can wait for everything
 * taken to also be {@link #taskDone() done}.
 *
 * <p>Every {@link #put(Object)} increments the unfinished count, and every {@link #taskDone()}
 * decrements it. Unlike {@link java.util.concurrent.BlockingQueue}, this supports joining with a
 * deadline via {@link #join(long, TimeUnit)}.
 */
public final class JoinableQueue<E> {
  final ReentrantLock lock = new ReentrantLock(false);
  final Condition notEmpty = lock.newCondition();
  final Condition allTasksDone = lock.newCondition();
  final ArrayDeque<E> elements = new ArrayDeque<E>();
  int unfinishedTasks;

  /** Enqueues without blocking. */
  public void put(E element) {
    if (element == null) throw new NullPointerException("element == null");
    lock.lock();
    try {
      elements.add(element);
      unfinishedTasks++;
      notEmpty.signal();
    } finally {
      lock.unlock();
    }
  }

  /** Blocks until an element is available. */
  public E take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (elements.isEmpty()) notEmpty.await();
      return elements.poll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Marks one element previously returned by {@link #take()} as processed.
   *
   * @throws IllegalStateException if called more times than elements were put
   */
  public void taskDone() {
    lock.lock();
    try {
      if (unfinishedTasks <= 0) throw new IllegalStateException("taskDone() called too many times");
      if (--unfinishedTasks == 0) allTasksDone.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits until all elements put were processed, or the timeout elapses.
   *
   * @return true if the queue drained, false on timeout
   */
  public boolean join(long timeout, TimeUnit unit) throws InterruptedException {
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (unfinishedTasks > 0) {
        // wake-ups can be spurious, so always measure against the deadline
        long nanosLeft = deadline - System.nanoTime();
        if (nanosLeft <= 0) return false;
        allTasksDone.awaitNanos(nanosLeft);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }

  /** Count of elements not yet taken. This is an approximation when other threads are active. */
  public int size() {
    lock.lock();
    try {
      return elements.size();
    } finally {
      lock.unlock();
    }
  }

  /** Count of elements put, but not yet marked done. */
  public int unfinishedTasks() {
    lock.lock();
    try {
      return unfinishedTasks;
    } finally {
      lock.unlock();
    }
  }
}

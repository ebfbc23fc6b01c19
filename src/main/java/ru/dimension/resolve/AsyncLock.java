package ru.dimension.resolve;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Non-blocking mutual exclusion for asynchronous sections.
 * Waiters are granted the lock in arrival order.
 */
final class AsyncLock {

  private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
  private boolean held;
  private boolean handingOff;
  private int pendingReleases;

  CompletableFuture<Void> acquire() {
    synchronized (this) {
      if (!held) {
        held = true;
        return CompletableFuture.completedFuture(null);
      }
      CompletableFuture<Void> waiter = new CompletableFuture<>();
      waiters.add(waiter);
      return waiter;
    }
  }

  /**
   * Passes ownership to the next waiter. A waiter may run its whole critical section
   * and release again inside {@code complete}; such releases are queued and served by
   * the loop below, so the stack stays flat however many waiters are queued.
   */
  void release() {
    synchronized (this) {
      if (handingOff) {
        pendingReleases++;
        return;
      }
      handingOff = true;
    }

    CompletableFuture<Void> next = handOff();
    while (next != null) {
      next.complete(null);
      synchronized (this) {
        if (pendingReleases == 0) {
          handingOff = false;
          return;
        }
        pendingReleases--;
      }
      next = handOff();
    }
  }

  private synchronized CompletableFuture<Void> handOff() {
    CompletableFuture<Void> next = waiters.poll();
    if (next == null) {
      held = false;
      handingOff = false;
    }
    return next;
  }

  synchronized boolean isHeld() {
    return held;
  }

  /**
   * Runs {@code action} while holding the lock; the lock is released once the
   * returned stage completes, successfully or not.
   */
  <T> CompletableFuture<T> withLock(Supplier<? extends CompletionStage<T>> action) {
    return acquire()
        .thenCompose(ignored -> Futures.<T>call(action))
        .whenComplete((value, failure) -> release());
  }
}

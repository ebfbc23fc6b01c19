package ru.dimension.resolve;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class AsyncLockTest {

  @Test
  void grantsInArrivalOrder() {
    AsyncLock lock = new AsyncLock();
    List<String> order = new ArrayList<>();

    CompletableFuture<Void> first = lock.acquire();
    CompletableFuture<Void> second = lock.acquire().thenRun(() -> order.add("second"));
    CompletableFuture<Void> third = lock.acquire().thenRun(() -> order.add("third"));

    assertTrue(first.isDone());
    assertFalse(second.isDone());
    assertFalse(third.isDone());

    lock.release();
    assertTrue(second.isDone());
    assertFalse(third.isDone());

    lock.release();
    lock.release();
    assertEquals(List.of("second", "third"), order);
    assertFalse(lock.isHeld());
  }

  @Test
  void withLockReleasesOnFailure() {
    AsyncLock lock = new AsyncLock();

    CompletableFuture<String> failed = lock.withLock(() -> {
      throw new IllegalStateException("inside");
    });

    assertTrue(failed.isCompletedExceptionally());
    assertFalse(lock.isHeld());
    assertEquals("ok", lock.withLock(() -> CompletableFuture.completedFuture("ok")).join());
  }

  @Test
  void withLockHoldsUntilStageCompletes() {
    AsyncLock lock = new AsyncLock();
    CompletableFuture<String> pending = new CompletableFuture<>();

    CompletableFuture<String> held = lock.withLock(() -> pending);
    CompletableFuture<String> waiting = lock.withLock(() -> CompletableFuture.completedFuture("next"));

    assertTrue(lock.isHeld());
    assertFalse(waiting.isDone());

    pending.complete("done");
    assertEquals("done", held.join());
    assertEquals("next", waiting.join());
    assertFalse(lock.isHeld());
  }

  @Test
  void handOffToManyWaitersKeepsStackFlat() {
    AsyncLock lock = new AsyncLock();
    CompletableFuture<Void> gate = new CompletableFuture<>();
    CompletableFuture<Void> first = lock.withLock(() -> gate);

    int waiters = 20_000;
    List<CompletableFuture<Integer>> queued = new ArrayList<>(waiters);
    for (int i = 0; i < waiters; i++) {
      int n = i;
      queued.add(lock.withLock(() -> CompletableFuture.completedFuture(n)));
    }

    gate.complete(null);

    first.join();
    for (int i = 0; i < waiters; i++) {
      assertEquals(i, queued.get(i).join());
    }
    assertFalse(lock.isHeld());
  }
}

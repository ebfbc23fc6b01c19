package ru.dimension.resolve;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReleaseStackTest {

  private static ReleaseStack.Releasable recording(List<String> events, String name) {
    return failure -> {
      events.add(name + (failure == null ? "" : ":" + failure.getMessage()));
      return CompletableFuture.completedFuture(null);
    };
  }

  @Test
  @DisplayName("Entries are released most recent first")
  void lifo() {
    List<String> events = new ArrayList<>();
    ReleaseStack stack = new ReleaseStack();
    stack.push(recording(events, "a"));
    stack.push(recording(events, "b"));
    stack.push(recording(events, "c"));

    stack.unwind(null).join();

    assertEquals(List.of("c", "b", "a"), events);
    assertEquals(0, stack.size());
  }

  @Test
  @DisplayName("Each release receives the failure that ended the scope")
  void failurePassedThrough() {
    List<String> events = new ArrayList<>();
    ReleaseStack stack = new ReleaseStack();
    stack.push(recording(events, "a"));

    stack.unwind(new IllegalStateException("boom")).join();

    assertEquals(List.of("a:boom"), events);
  }

  @Test
  @DisplayName("The first release failure is reported, later ones are suppressed")
  void failuresCollected() {
    List<String> events = new ArrayList<>();
    ReleaseStack stack = new ReleaseStack();
    stack.push(recording(events, "a"));
    stack.push(failure -> {
      throw new IllegalStateException("second");
    });
    stack.push(failure -> CompletableFuture.failedFuture(new IllegalStateException("first")));

    CompletionException e = assertThrows(CompletionException.class, () -> stack.unwind(null).join());

    assertEquals("first", e.getCause().getMessage());
    assertEquals(1, e.getCause().getSuppressed().length);
    assertEquals("second", e.getCause().getSuppressed()[0].getMessage());
    assertEquals(List.of("a"), events);
  }

  @Test
  @DisplayName("A null stage counts as an immediate release")
  void nullStage() {
    ReleaseStack stack = new ReleaseStack();
    stack.push(failure -> null);

    assertDoesNotThrow(() -> stack.unwind(null).join());
  }

  @Test
  @DisplayName("Nothing can be pushed once unwound")
  void pushAfterUnwind() {
    ReleaseStack stack = new ReleaseStack();
    stack.unwind(null).join();

    assertThrows(IllegalStateException.class, () -> stack.push(failure -> null));
  }
}

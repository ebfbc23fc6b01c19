package ru.dimension.resolve;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Small helpers around {@link CompletableFuture}.
 */
final class Futures {

  private Futures() {}

  /**
   * Strips the {@link CompletionException}/{@link ExecutionException} wrappers added by
   * stage composition.
   */
  static Throwable unwrap(Throwable t) {
    Throwable cur = t;
    while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
      cur = cur.getCause();
    }
    return cur;
  }

  /**
   * Runs {@code action}, turning a synchronous throw into a failed stage.
   */
  static <T> CompletableFuture<T> call(Supplier<? extends CompletionStage<T>> action) {
    try {
      CompletionStage<T> stage = action.get();
      return stage.toCompletableFuture();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /**
   * Blocks for the result, rethrowing the original failure when it is unchecked.
   */
  static <T> T join(CompletionStage<T> stage) {
    try {
      return stage.toCompletableFuture().join();
    } catch (CompletionException e) {
      Throwable cause = unwrap(e);
      if (cause instanceof RuntimeException re) throw re;
      if (cause instanceof Error err) throw err;
      throw e;
    }
  }
}

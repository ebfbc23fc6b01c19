package ru.dimension.resolve;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * A callable with a declared {@link Signature}. Dependencies are declared on the
 * signature and resolved by {@link Resolution} or {@link Bridge}.
 */
public interface Invocable<R> {

  String name();

  Signature signature();

  CompletionStage<R> invoke(Arguments arguments);

  @FunctionalInterface
  interface Body<R> {
    R apply(Arguments arguments) throws Exception;
  }

  /**
   * Synchronous callable; a thrown exception becomes a failed stage.
   */
  static <R> Invocable<R> of(String name, Signature signature, Body<? extends R> body) {
    Objects.requireNonNull(body, "body");
    return new FunctionInvocable<>(name, signature, arguments -> {
      try {
        return CompletableFuture.<R>completedFuture(body.apply(arguments));
      } catch (Exception e) {
        return CompletableFuture.<R>failedFuture(e);
      }
    });
  }

  static <R> Invocable<R> async(String name, Signature signature,
                                Function<Arguments, ? extends CompletionStage<R>> body) {
    Objects.requireNonNull(body, "body");
    return new FunctionInvocable<>(name, signature, arguments -> {
      try {
        return body.apply(arguments);
      } catch (RuntimeException e) {
        return CompletableFuture.<R>failedFuture(e);
      }
    });
  }
}

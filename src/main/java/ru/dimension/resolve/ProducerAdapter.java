package ru.dimension.resolve;

import java.util.concurrent.CompletableFuture;

/**
 * Turns a producer's raw result into a resolved value, registering cleanup on the
 * owning scope's release stack when the result is a resource.
 */
final class ProducerAdapter {

  private ProducerAdapter() {}

  static <T> CompletableFuture<T> adapt(Produced<T> produced, ReleaseStack stack) {
    if (produced == null) {
      return CompletableFuture.failedFuture(new IllegalStateException("Producer returned no result"));
    }

    // resource shapes first: an async resource must never be awaited as a plain stage
    if (produced instanceof Produced.AsyncResource<T> async) {
      return enterAsync(async.resource(), stack);
    }
    if (produced instanceof Produced.Resource<T> sync) {
      return enterSync(sync.resource(), stack);
    }
    if (produced instanceof Produced.Eventual<T> eventual) {
      return eventual.stage().toCompletableFuture().thenApply(v -> v);
    }
    if (produced instanceof Produced.Value<T> value) {
      return CompletableFuture.completedFuture(value.value());
    }
    throw new IllegalStateException("Unsupported producer result: " + produced.getClass().getName());
  }

  private static <T> CompletableFuture<T> enterAsync(AsyncScopedResource<? extends T> resource, ReleaseStack stack) {
    return Futures.<T>call(() -> resource.enter().thenApply(v -> v))
        .thenApply(value -> {
          stack.push(resource::exit);
          return value;
        });
  }

  private static <T> CompletableFuture<T> enterSync(ScopedResource<? extends T> resource, ReleaseStack stack) {
    final T value;
    try {
      value = resource.enter();
    } catch (Exception e) {
      return CompletableFuture.failedFuture(e);
    }
    stack.push(failure -> {
      try {
        resource.exit(failure);
        return CompletableFuture.completedFuture(null);
      } catch (Exception e) {
        return CompletableFuture.failedFuture(e);
      }
    });
    return CompletableFuture.completedFuture(value);
  }
}

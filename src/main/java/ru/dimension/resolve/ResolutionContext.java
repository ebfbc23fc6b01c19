package ru.dimension.resolve;

import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * State of one resolution scope: producer cache, release stack and the shared
 * context that was active when the scope was created.
 *
 * Every {@link Dependency#enter(ResolutionContext)} call receives the context of
 * the scope it resolves in, so unrelated scopes never observe each other's state.
 */
public final class ResolutionContext {

  private final Map<Producer<?>, CompletableFuture<Object>> cache;
  private final ReleaseStack releaseStack;
  private final SharedContext sharedContext;

  ResolutionContext(ReleaseStack releaseStack, SharedContext sharedContext) {
    this.cache = new IdentityHashMap<>();
    this.releaseStack = releaseStack;
    this.sharedContext = sharedContext;
  }

  /**
   * Fresh scope bound to the currently active {@link SharedContext}, if any.
   */
  static ResolutionContext open() {
    return new ResolutionContext(new ReleaseStack(), SharedContext.active());
  }

  public ReleaseStack releaseStack() {
    return releaseStack;
  }

  public Optional<SharedContext> sharedContext() {
    return Optional.ofNullable(sharedContext);
  }

  /**
   * Enters {@code dependency} in this scope and registers its exit on the release stack.
   */
  public <T> CompletableFuture<T> enter(Dependency<T> dependency) {
    return Futures.<T>call(() -> dependency.enter(this))
        .thenApply(value -> {
          releaseStack.push(dependency::exit);
          return value;
        });
  }

  /**
   * Resolves every dependency parameter of {@code signature} in declaration order.
   * A failure aborts the remaining parameters.
   */
  public CompletableFuture<Arguments> resolveParameters(Signature signature) {
    Map<String, Dependency<?>> parameters = signature.dependencyParameters();
    if (parameters.isEmpty()) {
      return CompletableFuture.completedFuture(Arguments.empty());
    }

    LinkedHashMap<String, Object> out = new LinkedHashMap<>();
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (Map.Entry<String, Dependency<?>> e : parameters.entrySet()) {
      chain = chain.thenCompose(ignored -> enterUntyped(e.getValue()))
          .thenAccept(value -> out.put(e.getKey(), value));
    }
    return chain.thenApply(ignored -> Arguments.of(out));
  }

  CompletableFuture<Object> enterUntyped(Dependency<?> dependency) {
    return enter(dependency).thenApply(Object.class::cast);
  }

  /**
   * Returns the value of {@code producer} in this scope, running {@code create} only for
   * the first request. Later requests, including ones made while the first is still in
   * flight, share its stage. A failed attempt is forgotten so the next request runs again.
   */
  @SuppressWarnings("unchecked")
  <T> CompletableFuture<T> memoize(Producer<T> producer, Supplier<? extends CompletionStage<T>> create) {
    CompletableFuture<Object> promise;
    synchronized (this) {
      CompletableFuture<Object> existing = cache.get(producer);
      if (existing != null) {
        return existing.thenApply(value -> (T) value);
      }
      promise = new CompletableFuture<>();
      cache.put(producer, promise);
    }

    CompletableFuture<Object> owned = promise;
    Futures.<T>call(create).whenComplete((value, failure) -> {
      if (failure == null) {
        owned.complete(value);
        return;
      }
      synchronized (this) {
        cache.remove(producer, owned);
      }
      owned.completeExceptionally(Futures.unwrap(failure));
    });
    return promise.thenApply(value -> (T) value);
  }
}

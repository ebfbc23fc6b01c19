package ru.dimension.resolve;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Resolved arguments of one resolution scope. Closing releases everything the scope
 * entered, in reverse order.
 */
public final class ResolvedDependencies implements AutoCloseable {

  private final Arguments arguments;
  private final ReleaseStack releaseStack;
  private final AtomicBoolean closed = new AtomicBoolean();

  ResolvedDependencies(Arguments arguments, ReleaseStack releaseStack) {
    this.arguments = arguments;
    this.releaseStack = releaseStack;
  }

  public Arguments arguments() {
    return arguments;
  }

  public CompletableFuture<Void> closeAsync() {
    if (!closed.compareAndSet(false, true)) {
      return CompletableFuture.completedFuture(null);
    }
    return releaseStack.unwind(null);
  }

  @Override
  public void close() {
    Futures.join(closeAsync());
  }
}

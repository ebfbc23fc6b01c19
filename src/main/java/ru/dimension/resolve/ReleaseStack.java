package ru.dimension.resolve;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered record of acquired resources, released in reverse acquisition order.
 *
 * Unwinding is sequential: each release starts after the previous one completed.
 * A failing release does not stop the unwind; the first failure is reported and
 * later ones are attached to it as suppressed.
 */
public final class ReleaseStack {

  private static final Logger log = LoggerFactory.getLogger(ReleaseStack.class);

  @FunctionalInterface
  public interface Releasable {
    CompletionStage<Void> release(Throwable failure);
  }

  private final Deque<Releasable> entries = new ArrayDeque<>();
  private boolean unwound;

  public synchronized void push(Releasable releasable) {
    if (unwound) {
      throw new IllegalStateException("Release stack has already been unwound");
    }
    entries.push(releasable);
  }

  public synchronized int size() {
    return entries.size();
  }

  /**
   * Releases every entry, most recent first.
   *
   * @param failure the error that ended the owning scope, or {@code null}
   */
  public CompletableFuture<Void> unwind(Throwable failure) {
    Releasable[] toRelease;
    synchronized (this) {
      unwound = true;
      toRelease = entries.toArray(new Releasable[0]);
      entries.clear();
    }

    AtomicReference<Throwable> releaseError = new AtomicReference<>();
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);

    // ArrayDeque#push adds to the head, so array order is already LIFO
    for (Releasable r : toRelease) {
      chain = chain
          .thenCompose(ignored -> releaseOne(r, failure))
          .handle((ignored, t) -> {
            if (t != null) {
              Throwable cause = Futures.unwrap(t);
              log.debug("Release failed: {}", cause.toString());
              if (!releaseError.compareAndSet(null, cause)) {
                releaseError.get().addSuppressed(cause);
              }
            }
            return null;
          });
    }

    return chain.thenCompose(ignored -> {
      Throwable t = releaseError.get();
      return t == null ? CompletableFuture.<Void>completedFuture(null) : CompletableFuture.<Void>failedFuture(t);
    });
  }

  private static CompletableFuture<Void> releaseOne(Releasable r, Throwable failure) {
    try {
      CompletionStage<Void> stage = r.release(failure);
      return stage == null ? CompletableFuture.completedFuture(null) : stage.toCompletableFuture();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }
}

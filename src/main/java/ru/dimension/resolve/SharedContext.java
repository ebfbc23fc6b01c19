package ru.dimension.resolve;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-lived scope for {@link Shared} dependencies.
 *
 * While open, every resolution created in the process sees this context: each shared
 * producer is invoked once, its value is cached and handed to all later requests, and
 * the resources it opened are released in reverse order when the context closes.
 *
 * <pre>
 *   try (SharedContext shared = SharedContext.open()) {
 *     Resolution.resolve(handler, Map.of());   // shared values created here
 *     Resolution.resolve(handler, Map.of());   // and reused here
 *   }                                         // shared resources released here
 * </pre>
 *
 * Opening a context replaces the active one and closing it restores the nearest
 * predecessor that is still open. Contexts may be closed in any order.
 */
public final class SharedContext implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(SharedContext.class);

  private static final AtomicReference<SharedContext> ACTIVE = new AtomicReference<>();

  enum State { UNOPENED, OPEN, CLOSED }

  private final ConcurrentHashMap<IdentityKey, Resolved> resolved = new ConcurrentHashMap<>();
  private final AsyncLock lock = new AsyncLock();
  private final ReleaseStack releaseStack = new ReleaseStack();
  private final ResolutionContext scope = new ResolutionContext(releaseStack, this);

  private volatile State state = State.UNOPENED;
  private volatile SharedContext previous;

  public SharedContext() {}

  /**
   * Creates a context and makes it the active one.
   */
  public static SharedContext open() {
    return new SharedContext().enter();
  }

  static SharedContext active() {
    return ACTIVE.get();
  }

  public synchronized SharedContext enter() {
    if (state != State.UNOPENED) {
      throw new SharedContextException("SharedContext can only be opened once, current state: " + state);
    }
    previous = ACTIVE.getAndSet(this);
    state = State.OPEN;
    log.debug("Shared context opened");
    return this;
  }

  public boolean isOpen() {
    return state == State.OPEN;
  }

  State state() {
    return state;
  }

  /**
   * Releases all shared resources in reverse acquisition order, then restores the
   * nearest open predecessor if this context is still the active one. Closing twice
   * is a no-op.
   */
  public CompletableFuture<Void> closeAsync() {
    synchronized (this) {
      if (state == State.CLOSED) {
        return CompletableFuture.completedFuture(null);
      }
      if (state == State.UNOPENED) {
        throw new SharedContextException("SharedContext was never opened");
      }
      state = State.CLOSED;
    }

    log.debug("Closing shared context, releasing {} resource(s)", releaseStack.size());
    return releaseStack.unwind(null)
        .whenComplete((ignored, failure) -> {
          resolved.clear();
          ACTIVE.compareAndSet(this, openPredecessor());
        });
  }

  @Override
  public void close() {
    Futures.join(closeAsync());
  }

  /**
   * Returns the shared value for {@code producer}, creating it on first request.
   *
   * The cached path takes no lock. On a miss the producer's own dependencies are
   * resolved first, then the lock is taken and the cache checked again, so a producer
   * runs at most once per context even when several callers miss at the same time.
   */
  @SuppressWarnings("unchecked")
  <T> CompletableFuture<T> acquire(Producer<T> producer) {
    ensureOpen();

    IdentityKey key = new IdentityKey(producer);
    Resolved hit = resolved.get(key);
    if (hit != null) {
      return CompletableFuture.completedFuture((T) hit.value());
    }

    return scope.resolveParameters(producer.signature())
        .thenCompose(arguments -> lock.withLock(() -> {
          Resolved again = resolved.get(key);
          if (again != null) {
            return CompletableFuture.completedFuture((T) again.value());
          }
          ensureOpen();
          log.debug("Initializing shared producer {}", producer);
          return FunctionalDependency.produce(producer, arguments, releaseStack)
              .thenApply(value -> {
                resolved.put(key, new Resolved(value));
                return value;
              });
        }));
  }

  boolean isResolved(Producer<?> producer) {
    return resolved.containsKey(new IdentityKey(producer));
  }

  private SharedContext openPredecessor() {
    SharedContext p = previous;
    while (p != null && p.state == State.CLOSED) {
      p = p.previous;
    }
    return p;
  }

  private void ensureOpen() {
    State s = state;
    if (s != State.OPEN) {
      throw new SharedContextException("SharedContext is not open (state: " + s + ")");
    }
  }

  private record Resolved(Object value) {}
}

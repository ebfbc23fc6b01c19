package ru.dimension.resolve;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exposes invocables with their dependency parameters hidden.
 *
 * The bridged invocable resolves dependencies on every call, merges them with the
 * caller's arguments (caller wins) and invokes the original once the scope is open.
 * Bridges are memoized per original instance in a bounded LRU cache.
 */
public final class Bridge {

  private static final Logger log = LoggerFactory.getLogger(Bridge.class);

  public static final int DEFAULT_CACHE_LIMIT = 5_000;

  private static volatile int cacheLimit = DEFAULT_CACHE_LIMIT;

  private static final LinkedHashMap<IdentityKey, Invocable<?>> cache =
      new LinkedHashMap<>(64, 0.75f, true) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<IdentityKey, Invocable<?>> eldest) {
          return size() > cacheLimit;
        }
      };

  private Bridge() {}

  public static void setCacheLimit(int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("Cache limit must be positive, got " + limit);
    }
    synchronized (cache) {
      cacheLimit = limit;
      Iterator<IdentityKey> it = cache.keySet().iterator();
      while (cache.size() > limit && it.hasNext()) {
        it.next();
        it.remove();
      }
    }
  }

  public static void clearCache() {
    synchronized (cache) {
      cache.clear();
    }
  }

  static int cacheSize() {
    synchronized (cache) {
      return cache.size();
    }
  }

  /**
   * Returns {@code function} itself when it declares no dependencies, otherwise an
   * invocable whose signature omits the dependency parameters.
   */
  @SuppressWarnings("unchecked")
  public static <R> Invocable<R> withoutDependencies(Invocable<R> function) {
    Objects.requireNonNull(function, "function");
    IdentityKey key = new IdentityKey(function);

    synchronized (cache) {
      Invocable<?> hit = cache.get(key);
      if (hit != null) return (Invocable<R>) hit;
    }

    Invocable<R> bridged = function.signature().hasDependencies()
        ? new BridgedInvocable<>(function)
        : function;

    synchronized (cache) {
      Invocable<?> raced = cache.putIfAbsent(key, bridged);
      return raced != null ? (Invocable<R>) raced : bridged;
    }
  }

  static final class BridgedInvocable<R> implements Invocable<R> {
    private final Invocable<R> original;
    private final Signature visible;

    private BridgedInvocable(Invocable<R> original) {
      this.original = original;
      this.visible = original.signature().withoutDependencies();
      log.debug("Bridged {} as {}{}", original, original.name(), visible);
    }

    Invocable<R> original() {
      return original;
    }

    @Override
    public String name() {
      return original.name();
    }

    @Override
    public Signature signature() {
      return visible;
    }

    @Override
    public CompletionStage<R> invoke(Arguments arguments) {
      Arguments provided = arguments == null ? Arguments.empty() : arguments;
      return Resolution.using(original, provided, resolved -> original.invoke(resolved.with(provided)));
    }

    @Override
    public String toString() {
      return original.name() + visible;
    }
  }
}

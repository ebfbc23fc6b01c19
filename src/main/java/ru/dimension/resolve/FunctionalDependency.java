package ru.dimension.resolve;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Base for dependencies backed by a {@link Producer}.
 */
public abstract class FunctionalDependency<T> implements Dependency<T> {

  protected final Producer<T> producer;

  protected FunctionalDependency(Producer<T> producer) {
    this.producer = Objects.requireNonNull(producer, "producer");
  }

  public Producer<T> producer() {
    return producer;
  }

  /**
   * Invokes {@code producer} and adapts its result, entering resources into {@code stack}.
   */
  static <T> CompletableFuture<T> produce(Producer<T> producer, Arguments arguments, ReleaseStack stack) {
    final Produced<T> raw;
    try {
      raw = producer.produce(arguments);
    } catch (Exception e) {
      return CompletableFuture.failedFuture(e);
    }
    return ProducerAdapter.adapt(raw, stack);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + producer + ")";
  }
}

package ru.dimension.resolve;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Shape of a producer's raw result.
 *
 * Closed on purpose: {@link ProducerAdapter} handles every variant, and a new
 * variant has to be added there as well.
 */
public sealed interface Produced<T> {

  record Value<T>(T value) implements Produced<T> {}

  record Eventual<T>(CompletionStage<? extends T> stage) implements Produced<T> {
    public Eventual {
      Objects.requireNonNull(stage, "stage");
    }
  }

  record Resource<T>(ScopedResource<? extends T> resource) implements Produced<T> {
    public Resource {
      Objects.requireNonNull(resource, "resource");
    }
  }

  record AsyncResource<T>(AsyncScopedResource<? extends T> resource) implements Produced<T> {
    public AsyncResource {
      Objects.requireNonNull(resource, "resource");
    }
  }

  static <T> Produced<T> value(T value) {
    return new Value<>(value);
  }

  static <T> Produced<T> eventually(CompletionStage<? extends T> stage) {
    return new Eventual<>(stage);
  }

  static <T> Produced<T> resource(ScopedResource<? extends T> resource) {
    return new Resource<>(resource);
  }

  static <T extends AutoCloseable> Produced<T> closing(T closeable) {
    return new Resource<>(ScopedResource.closing(closeable));
  }

  static <T> Produced<T> asyncResource(AsyncScopedResource<? extends T> resource) {
    return new AsyncResource<>(resource);
  }
}

package ru.dimension.resolve;

import java.util.Objects;

/**
 * Synchronous resource with an enter/exit lifecycle. The resolver enters it once
 * and exits it when the owning scope unwinds.
 */
public interface ScopedResource<T> {

  T enter() throws Exception;

  void exit(Throwable failure) throws Exception;

  /**
   * Wraps an already-open {@link AutoCloseable}; exit closes it.
   */
  static <T extends AutoCloseable> ScopedResource<T> closing(T resource) {
    Objects.requireNonNull(resource, "resource");
    return new ScopedResource<>() {
      @Override
      public T enter() {
        return resource;
      }

      @Override
      public void exit(Throwable failure) throws Exception {
        resource.close();
      }
    };
  }
}

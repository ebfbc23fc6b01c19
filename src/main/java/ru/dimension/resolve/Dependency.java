package ru.dimension.resolve;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Base contract for everything the resolver can inject.
 *
 * Implementations produce their value in {@link #enter(ResolutionContext)} and
 * may release it in {@link #exit(Throwable)}. The resolver enters each dependency
 * and pushes its exit onto the owning scope's release stack, so cleanup runs in
 * reverse order when the scope ends.
 *
 * Annotate an implementation type with {@link Exclusive} to allow at most one
 * instance of that type (or any subtype) per callable. Exclusivity is a property of
 * the type and is looked up with {@link DependencyValidator#isExclusive(Class)}.
 */
public interface Dependency<T> {

  CompletionStage<T> enter(ResolutionContext context);

  /**
   * @param failure the error that ended the scope, or {@code null} on success
   */
  default CompletionStage<Void> exit(Throwable failure) {
    return CompletableFuture.completedFuture(null);
  }

  /**
   * Returns a dependency bound to a parameter's name and final value.
   * Called for dependencies declared as parameter annotations. The default returns {@code this}.
   */
  default Dependency<T> bindToParameter(String name, Object value) {
    return this;
  }
}

package ru.dimension.resolve;

import java.util.concurrent.CompletionStage;

/**
 * Dependency resolved once per {@link SharedContext} and reused by every resolution
 * that runs while the context is open. Identity is the producer: any number of
 * {@code Shared} declarations over one producer share one value.
 *
 * Resources produced here are released when the shared context closes.
 */
public class Shared<T> extends FunctionalDependency<T> {

  public Shared(Producer<T> producer) {
    super(producer);
  }

  public static <T> Shared<T> on(Producer<T> producer) {
    return new Shared<>(producer);
  }

  @Override
  public CompletionStage<T> enter(ResolutionContext context) {
    SharedContext shared = context.sharedContext()
        .orElseThrow(() -> new SharedContextException(
            "Shared dependency " + producer + " requested outside of an open SharedContext"));
    return shared.acquire(producer);
  }
}

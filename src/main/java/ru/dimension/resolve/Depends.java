package ru.dimension.resolve;

import java.util.concurrent.CompletionStage;

/**
 * Call-scoped dependency: the producer runs at most once per resolution scope and
 * every declaration of the same producer in that scope receives the same value, also when
 * the declarations are resolved concurrently.
 */
public class Depends<T> extends FunctionalDependency<T> {

  public Depends(Producer<T> producer) {
    super(producer);
  }

  public static <T> Depends<T> on(Producer<T> producer) {
    return new Depends<>(producer);
  }

  @Override
  public CompletionStage<T> enter(ResolutionContext context) {
    return context.memoize(producer, () -> context.resolveParameters(producer.signature())
        .thenCompose(arguments -> produce(producer, arguments, context.releaseStack())));
  }
}

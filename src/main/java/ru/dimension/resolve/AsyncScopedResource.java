package ru.dimension.resolve;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous counterpart of {@link ScopedResource}.
 */
public interface AsyncScopedResource<T> {

  CompletionStage<T> enter();

  CompletionStage<Void> exit(Throwable failure);
}

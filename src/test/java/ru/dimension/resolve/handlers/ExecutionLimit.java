package ru.dimension.resolve.handlers;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import ru.dimension.resolve.Dependency;
import ru.dimension.resolve.Exclusive;
import ru.dimension.resolve.ResolutionContext;

@Exclusive
public abstract class ExecutionLimit implements Dependency<ExecutionLimit> {

  @Override
  public CompletionStage<ExecutionLimit> enter(ResolutionContext context) {
    return CompletableFuture.completedFuture(this);
  }
}

package ru.dimension.resolve;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

final class FunctionInvocable<R> implements Invocable<R> {

  private final String name;
  private final Signature signature;
  private final Function<Arguments, ? extends CompletionStage<R>> body;

  FunctionInvocable(String name, Signature signature, Function<Arguments, ? extends CompletionStage<R>> body) {
    this.name = Objects.requireNonNull(name, "name");
    this.signature = Objects.requireNonNull(signature, "signature");
    this.body = body;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Signature signature() {
    return signature;
  }

  @Override
  public CompletionStage<R> invoke(Arguments arguments) {
    return body.apply(arguments == null ? Arguments.empty() : arguments);
  }

  @Override
  public String toString() {
    return name + signature;
  }
}

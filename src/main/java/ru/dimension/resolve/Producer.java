package ru.dimension.resolve;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Recipe for a dependency value.
 *
 * A producer is identified by reference: two {@link Depends} or {@link Shared}
 * declarations over the same producer instance resolve to the same cached value,
 * while two distinct producers never share a value even when their outputs are equal.
 *
 * The producer's own {@link #signature()} may declare further dependencies;
 * they are resolved first and handed to {@link #produce(Arguments)}.
 */
@FunctionalInterface
public interface Producer<T> {

  Produced<T> produce(Arguments arguments) throws Exception;

  default Signature signature() {
    return Signature.empty();
  }

  static <T> Producer<T> of(Signature signature, Producer<T> body) {
    return new DeclaredProducer<>(signature, body);
  }

  static <T> Producer<T> of(Supplier<? extends T> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    return arguments -> Produced.value(supplier.get());
  }

  static <T> Producer<T> eventually(Supplier<? extends CompletionStage<? extends T>> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    return arguments -> Produced.eventually(supplier.get());
  }

  static <T> Producer<T> resource(Supplier<? extends ScopedResource<? extends T>> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    return arguments -> Produced.resource(supplier.get());
  }

  static <T> Producer<T> asyncResource(Supplier<? extends AsyncScopedResource<? extends T>> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    return arguments -> Produced.asyncResource(supplier.get());
  }

  final class DeclaredProducer<T> implements Producer<T> {
    private final Signature signature;
    private final Producer<T> body;

    private DeclaredProducer(Signature signature, Producer<T> body) {
      this.signature = Objects.requireNonNull(signature, "signature");
      this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public Produced<T> produce(Arguments arguments) throws Exception {
      return body.produce(arguments);
    }

    @Override
    public Signature signature() {
      return signature;
    }
  }
}

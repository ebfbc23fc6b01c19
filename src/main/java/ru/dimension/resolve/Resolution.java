package ru.dimension.resolve;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for resolving the dependencies declared on an {@link Invocable}.
 *
 * Each call opens a fresh resolution scope:
 * <ol>
 *   <li>parameters whose default is a dependency are resolved in declaration order,
 *       unless the caller supplied a value for them;</li>
 *   <li>annotation dependencies are then bound to the final parameter values and entered;</li>
 *   <li>once the caller is done, everything entered is released in reverse order.</li>
 * </ol>
 *
 * A failing default dependency is recorded as a {@link FailedDependency} and does not stop
 * the resolution. A failing annotation dependency aborts it. Release always runs, and it is
 * not affected by cancelling the returned stage.
 */
public final class Resolution {

  private static final Logger log = LoggerFactory.getLogger(Resolution.class);

  private Resolution() {}

  /**
   * Resolves dependencies, runs {@code body} with them and releases the scope once the
   * stage returned by {@code body} completes.
   */
  public static <R> CompletableFuture<R> using(Invocable<?> function,
                                               Map<String, ?> overrides,
                                               Function<Arguments, ? extends CompletionStage<R>> body) {
    return using(function, Arguments.of(overrides), body);
  }

  public static <R> CompletableFuture<R> using(Invocable<?> function,
                                               Arguments overrides,
                                               Function<Arguments, ? extends CompletionStage<R>> body) {
    Arguments provided = overrides == null ? Arguments.empty() : overrides;
    ResolutionContext context = ResolutionContext.open();
    log.debug("Resolving dependencies of {}", function.name());

    CompletableFuture<R> work = resolveArguments(function.signature(), provided, context)
        .thenCompose(arguments -> Futures.<R>call(() -> body.apply(arguments)));

    return work
        .handle((value, failure) -> {
          Throwable cause = failure == null ? null : Futures.unwrap(failure);
          return context.releaseStack().unwind(cause)
              .handle((ignored, releaseFailure) -> finish(value, cause, releaseFailure))
              .thenCompose(f -> f);
        })
        .thenCompose(f -> f);
  }

  /**
   * Blocking variant: resolves now and returns a handle that releases on close.
   *
   * <pre>
   *   try (ResolvedDependencies deps = Resolution.resolve(handler, Map.of("id", 42))) {
   *     Connection c = deps.arguments().get("connection", Connection.class);
   *   }
   * </pre>
   */
  public static ResolvedDependencies resolve(Invocable<?> function, Map<String, ?> overrides) {
    Arguments provided = Arguments.of(overrides);
    ResolutionContext context = ResolutionContext.open();
    log.debug("Resolving dependencies of {}", function.name());

    try {
      Arguments arguments = Futures.join(resolveArguments(function.signature(), provided, context));
      return new ResolvedDependencies(arguments, context.releaseStack());
    } catch (RuntimeException | Error e) {
      try {
        Futures.join(context.releaseStack().unwind(e));
      } catch (RuntimeException | Error releaseFailure) {
        e.addSuppressed(releaseFailure);
      }
      throw e;
    }
  }

  public static ResolvedDependencies resolve(Invocable<?> function) {
    return resolve(function, Map.of());
  }

  static CompletableFuture<Arguments> resolveArguments(Signature signature,
                                                       Arguments provided,
                                                       ResolutionContext context) {
    LinkedHashMap<String, Object> arguments = new LinkedHashMap<>();
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);

    for (Map.Entry<String, Dependency<?>> e : signature.dependencyParameters().entrySet()) {
      String name = e.getKey();
      Dependency<?> dependency = e.getValue();

      chain = chain.thenCompose(ignored -> {
        if (provided.contains(name)) {
          arguments.put(name, provided.get(name));
          return CompletableFuture.completedFuture(null);
        }
        return context.enterUntyped(dependency).handle((value, failure) -> {
          if (failure == null) {
            arguments.put(name, value);
            return null;
          }
          Throwable cause = Futures.unwrap(failure);
          if (!isRecoverable(cause)) {
            throw new CompletionException(cause);
          }
          log.debug("Dependency for parameter '{}' failed: {}", name, cause.toString());
          arguments.put(name, new FailedDependency(name, cause));
          return null;
        });
      });
    }

    chain = chain.thenCompose(ignored -> bindAnnotations(signature, provided, arguments, context));
    return chain.thenApply(ignored -> Arguments.of(arguments));
  }

  /**
   * Runs after all default dependencies so each annotation dependency observes the
   * parameter's final value. Failures propagate.
   */
  private static CompletableFuture<Void> bindAnnotations(Signature signature,
                                                         Arguments provided,
                                                         Map<String, Object> arguments,
                                                         ResolutionContext context) {
    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);

    for (Map.Entry<String, List<Dependency<?>>> e : signature.annotationDependencies().entrySet()) {
      String name = e.getKey();
      for (Dependency<?> dependency : e.getValue()) {
        chain = chain.thenCompose(ignored -> {
          Object value = provided.contains(name) ? provided.get(name) : arguments.get(name);
          Dependency<?> bound = dependency.bindToParameter(name, value);
          return context.enterUntyped(bound).thenAccept(entered -> {});
        });
      }
    }
    return chain;
  }

  private static boolean isRecoverable(Throwable cause) {
    return cause instanceof Exception && !(cause instanceof SharedContextException);
  }

  private static <R> CompletableFuture<R> finish(R value, Throwable failure, Throwable releaseFailure) {
    if (failure != null) {
      if (releaseFailure != null) {
        failure.addSuppressed(Futures.unwrap(releaseFailure));
      }
      return CompletableFuture.failedFuture(failure);
    }
    if (releaseFailure != null) {
      return CompletableFuture.failedFuture(Futures.unwrap(releaseFailure));
    }
    return CompletableFuture.completedFuture(value);
  }
}

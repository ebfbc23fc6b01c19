package ru.dimension.resolve;

import java.util.Objects;

/**
 * Placeholder stored in {@link Arguments} for a dependency whose producer failed.
 */
public record FailedDependency(String parameter, Throwable error) {
  public FailedDependency {
    Objects.requireNonNull(parameter, "parameter");
    Objects.requireNonNull(error, "error");
  }
}

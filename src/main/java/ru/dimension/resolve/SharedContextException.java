package ru.dimension.resolve;

/**
 * Thrown when shared dependencies are used without an open {@link SharedContext}.
 * Never captured as a {@link FailedDependency}.
 */
public class SharedContextException extends IllegalStateException {
  public SharedContextException(String message) {
    super(message);
  }
}

package ru.dimension.resolve;

import java.util.List;
import java.util.Objects;

/**
 * One declared parameter of a callable.
 *
 * @param dependency  dependency used as the parameter's default, or {@code null}
 * @param annotations dependencies attached to the parameter as metadata; they observe
 *                    the parameter's final value instead of supplying one
 */
public record Parameter(String name, Class<?> type, Dependency<?> dependency, List<Dependency<?>> annotations) {

  public Parameter {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Parameter name must be non-blank");
    }
    type = type == null ? Object.class : type;
    annotations = annotations == null ? List.of() : List.copyOf(annotations);
  }

  public static Parameter plain(String name, Class<?> type) {
    return new Parameter(name, type, null, List.of());
  }

  public boolean hasDependency() {
    return dependency != null;
  }

  public boolean hasAnnotations() {
    return !annotations.isEmpty();
  }
}

package ru.dimension.resolve;

import java.util.*;

/**
 * Ordered, immutable name to value mapping passed to producers and invocables.
 *
 * Values may be {@code null}. A value may also be a {@link FailedDependency} when a
 * call-scoped dependency could not be produced; {@link #get(String, Class)} turns
 * such a placeholder back into an exception.
 */
public final class Arguments {

  private static final Arguments EMPTY = new Arguments(Collections.emptyMap());

  private final Map<String, Object> values;

  private Arguments(Map<String, Object> values) {
    this.values = values;
  }

  public static Arguments empty() {
    return EMPTY;
  }

  public static Arguments of(Map<String, ?> values) {
    if (values == null || values.isEmpty()) return EMPTY;
    return new Arguments(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
  }

  public static Arguments of(String name, Object value) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(name, value);
    return new Arguments(Collections.unmodifiableMap(m));
  }

  public boolean contains(String name) {
    return values.containsKey(name);
  }

  public Object get(String name) {
    return values.get(name);
  }

  /**
   * Typed access.
   *
   * @throws IllegalStateException if the value is a {@link FailedDependency} and
   *                               {@code type} is not {@code FailedDependency}
   * @throws ClassCastException    if the value is not an instance of {@code type}
   */
  public <T> T get(String name, Class<T> type) {
    Object value = values.get(name);
    if (value instanceof FailedDependency failed && type != FailedDependency.class) {
      throw new IllegalStateException(
          "Dependency for parameter '" + failed.parameter() + "' failed to resolve", failed.error());
    }
    return type.cast(value);
  }

  public Set<String> names() {
    return values.keySet();
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public List<FailedDependency> failures() {
    List<FailedDependency> out = new ArrayList<>();
    for (Object v : values.values()) {
      if (v instanceof FailedDependency f) out.add(f);
    }
    return List.copyOf(out);
  }

  /**
   * Returns a copy where entries of {@code overrides} replace entries of this instance.
   */
  public Arguments with(Arguments overrides) {
    if (overrides == null || overrides.isEmpty()) return this;
    if (isEmpty()) return overrides;
    LinkedHashMap<String, Object> merged = new LinkedHashMap<>(values);
    merged.putAll(overrides.values);
    return new Arguments(Collections.unmodifiableMap(merged));
  }

  public Map<String, Object> asMap() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Arguments a)) return false;
    return values.equals(a.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "Arguments" + values;
  }
}

package ru.dimension.resolve;

import java.util.*;

/**
 * Ordered parameter declaration of a callable or producer.
 *
 * The dependency views are computed once per instance and reused by every resolution.
 */
public final class Signature {

  private static final Signature EMPTY = new Signature(List.of());

  private final List<Parameter> parameters;
  private final Map<String, Dependency<?>> dependencyParameters;
  private final Map<String, List<Dependency<?>>> annotationDependencies;

  private Signature(List<Parameter> parameters) {
    this.parameters = List.copyOf(parameters);

    LinkedHashMap<String, Dependency<?>> deps = new LinkedHashMap<>();
    LinkedHashMap<String, List<Dependency<?>>> annotated = new LinkedHashMap<>();
    for (Parameter p : this.parameters) {
      if (p.hasDependency()) deps.put(p.name(), p.dependency());
      if (p.hasAnnotations()) annotated.put(p.name(), p.annotations());
    }
    this.dependencyParameters = Collections.unmodifiableMap(deps);
    this.annotationDependencies = Collections.unmodifiableMap(annotated);
  }

  public static Signature empty() {
    return EMPTY;
  }

  public static Signature of(List<Parameter> parameters) {
    return parameters.isEmpty() ? EMPTY : new Signature(checkUnique(parameters));
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Parameter> parameters() {
    return parameters;
  }

  public List<String> parameterNames() {
    List<String> out = new ArrayList<>(parameters.size());
    for (Parameter p : parameters) out.add(p.name());
    return List.copyOf(out);
  }

  public Optional<Parameter> parameter(String name) {
    for (Parameter p : parameters) {
      if (p.name().equals(name)) return Optional.of(p);
    }
    return Optional.empty();
  }

  /**
   * Parameters whose default is a dependency, in declaration order.
   */
  public Map<String, Dependency<?>> dependencyParameters() {
    return dependencyParameters;
  }

  /**
   * Dependencies attached to parameters as metadata, keyed by parameter name.
   */
  public Map<String, List<Dependency<?>>> annotationDependencies() {
    return annotationDependencies;
  }

  public boolean hasDependencies() {
    return !dependencyParameters.isEmpty() || !annotationDependencies.isEmpty();
  }

  /**
   * The signature callers see once dependency parameters are resolved for them.
   * Parameters carrying only annotation dependencies stay visible.
   */
  public Signature withoutDependencies() {
    if (dependencyParameters.isEmpty()) return this;
    return Signature.of(visibleParameters());
  }

  public List<Parameter> visibleParameters() {
    if (dependencyParameters.isEmpty()) return parameters;
    List<Parameter> visible = new ArrayList<>();
    for (Parameter p : parameters) {
      if (!p.hasDependency()) visible.add(p);
    }
    return List.copyOf(visible);
  }

  private static List<Parameter> checkUnique(List<Parameter> parameters) {
    Set<String> seen = new HashSet<>();
    for (Parameter p : parameters) {
      if (!seen.add(p.name())) {
        throw new IllegalArgumentException("Duplicate parameter name: " + p.name());
      }
    }
    return parameters;
  }

  @Override
  public String toString() {
    StringJoiner j = new StringJoiner(", ", "(", ")");
    for (Parameter p : parameters) {
      j.add(p.type().getSimpleName() + " " + p.name() + (p.hasDependency() ? " = " + p.dependency() : ""));
    }
    return j.toString();
  }

  public static final class Builder {
    private final List<Parameter> parameters = new ArrayList<>();

    private Builder() {}

    public Builder parameter(String name) {
      return parameter(Parameter.plain(name, Object.class));
    }

    public Builder parameter(String name, Class<?> type) {
      return parameter(Parameter.plain(name, type));
    }

    public Builder parameter(Parameter parameter) {
      parameters.add(Objects.requireNonNull(parameter, "parameter"));
      return this;
    }

    public Builder dependency(String name, Dependency<?> dependency) {
      return dependency(name, Object.class, dependency);
    }

    public Builder dependency(String name, Class<?> type, Dependency<?> dependency) {
      Objects.requireNonNull(dependency, "dependency");
      return parameter(new Parameter(name, type, dependency, List.of()));
    }

    /**
     * Declares a parameter carrying annotation dependencies.
     */
    public Builder annotated(String name, Class<?> type, Dependency<?>... annotations) {
      return parameter(new Parameter(name, type, null, List.of(annotations)));
    }

    public Signature build() {
      return Signature.of(parameters);
    }
  }
}

package ru.dimension.resolve;

import java.util.*;

/**
 * Checks the dependency declarations of a callable.
 *
 * Rules, checked in this order:
 * <ol>
 *   <li>at most one default dependency of any {@link Exclusive} concrete type;</li>
 *   <li>at most one default dependency that is an instance of any exclusive supertype;</li>
 *   <li>at most one annotation dependency of an exclusive type per parameter.</li>
 * </ol>
 * Annotation dependencies are scoped to their parameter: the same exclusive type may
 * annotate several parameters, once each.
 * Concrete duplicates are reported first so the message names the exact type
 * (for example {@code Retry}) rather than a shared ancestor.
 */
public final class DependencyValidator {

  private static final ClassValue<Boolean> EXCLUSIVE = new ClassValue<>() {
    @Override
    protected Boolean computeValue(Class<?> type) {
      return Boolean.TRUE.equals(declaredExclusivity(type));
    }
  };

  private DependencyValidator() {}

  /**
   * @throws IllegalArgumentException naming the offending type when a rule is violated
   */
  public static void validate(Invocable<?> function) {
    validate(function.signature());
  }

  public static void validate(Signature signature) {
    List<Dependency<?>> defaults = new ArrayList<>(signature.dependencyParameters().values());

    checkConcreteTypes(defaults);
    checkExclusiveAncestors(defaults);

    for (Map.Entry<String, List<Dependency<?>>> e : signature.annotationDependencies().entrySet()) {
      checkPerParameter(e.getKey(), e.getValue());
    }
  }

  /**
   * Whether {@code type} is exclusive. The nearest {@link Exclusive} declaration wins:
   * the type itself, then its superclasses, then its interfaces.
   */
  public static boolean isExclusive(Class<?> type) {
    return EXCLUSIVE.get(type);
  }

  private static void checkConcreteTypes(List<Dependency<?>> dependencies) {
    for (Map.Entry<Class<?>, Integer> e : countByType(dependencies).entrySet()) {
      if (e.getValue() > 1 && isExclusive(e.getKey())) {
        throw new IllegalArgumentException("Only one " + typeName(e.getKey()) + " dependency is allowed");
      }
    }
  }

  private static void checkExclusiveAncestors(List<Dependency<?>> dependencies) {
    LinkedHashSet<Class<?>> exclusiveTypes = new LinkedHashSet<>();
    for (Dependency<?> d : dependencies) {
      for (Class<?> c : hierarchy(d.getClass())) {
        if (c != Dependency.class && Dependency.class.isAssignableFrom(c) && isExclusive(c)) {
          exclusiveTypes.add(c);
        }
      }
    }

    for (Class<?> base : exclusiveTypes) {
      List<Dependency<?>> instances = new ArrayList<>();
      for (Dependency<?> d : dependencies) {
        if (base.isInstance(d)) instances.add(d);
      }
      if (instances.size() > 1) {
        StringJoiner found = new StringJoiner(", ");
        for (Dependency<?> d : instances) found.add(typeName(d.getClass()));
        throw new IllegalArgumentException(
            "Only one " + typeName(base) + " dependency is allowed, but found: " + found);
      }
    }
  }

  private static void checkPerParameter(String parameter, List<Dependency<?>> dependencies) {
    for (Map.Entry<Class<?>, Integer> e : countByType(dependencies).entrySet()) {
      if (e.getValue() > 1 && isExclusive(e.getKey())) {
        throw new IllegalArgumentException(
            "Only one " + typeName(e.getKey()) + " annotation dependency is allowed per parameter, but found "
                + e.getValue() + " on '" + parameter + "'");
      }
    }
  }

  private static Map<Class<?>, Integer> countByType(List<Dependency<?>> dependencies) {
    LinkedHashMap<Class<?>, Integer> counts = new LinkedHashMap<>();
    for (Dependency<?> d : dependencies) {
      counts.merge(d.getClass(), 1, Integer::sum);
    }
    return counts;
  }

  /**
   * The type, its superclasses, then every interface reachable from them.
   */
  static Set<Class<?>> hierarchy(Class<?> type) {
    LinkedHashSet<Class<?>> out = new LinkedHashSet<>();
    Deque<Class<?>> interfaces = new ArrayDeque<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      out.add(c);
      interfaces.addAll(Arrays.asList(c.getInterfaces()));
    }
    while (!interfaces.isEmpty()) {
      Class<?> i = interfaces.poll();
      if (out.add(i)) {
        interfaces.addAll(Arrays.asList(i.getInterfaces()));
      }
    }
    return out;
  }

  private static Boolean declaredExclusivity(Class<?> type) {
    Exclusive own = type.getDeclaredAnnotation(Exclusive.class);
    if (own != null) return own.value();

    Class<?> sup = type.getSuperclass();
    if (sup != null && sup != Object.class) {
      Boolean inherited = declaredExclusivity(sup);
      if (inherited != null) return inherited;
    }
    for (Class<?> i : type.getInterfaces()) {
      Boolean inherited = declaredExclusivity(i);
      if (inherited != null) return inherited;
    }
    return null;
  }

  private static String typeName(Class<?> type) {
    String simple = type.getSimpleName();
    return simple.isEmpty() ? type.getName() : simple;
  }
}

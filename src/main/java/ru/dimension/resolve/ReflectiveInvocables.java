package ru.dimension.resolve;

import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link Invocable}s from plain Java methods.
 *
 * Parameter declarations are read from annotations:
 * <ul>
 *   <li>{@link Named} - parameter name (defaults to the compiled name, so compile with {@code -parameters});</li>
 *   <li>{@link Provided} - the parameter is a call-scoped or shared dependency;</li>
 *   <li>{@link Observed} - annotation dependencies bound to the parameter's value.</li>
 * </ul>
 *
 * A method returning a {@link CompletionStage} is treated as asynchronous.
 * Signatures are computed once per method.
 */
public final class ReflectiveInvocables {

  private static final Logger log = LoggerFactory.getLogger(ReflectiveInvocables.class);

  private static final Map<Method, Signature> SIGNATURES = new ConcurrentHashMap<>();
  private static final Map<Class<?>, Producer<?>> PRODUCERS = new ConcurrentHashMap<>();

  private ReflectiveInvocables() {}

  /**
   * @param target receiver, or {@code null} for a static method
   */
  public static <R> Invocable<R> of(Object target, Method method) {
    Objects.requireNonNull(method, "method");
    boolean isStatic = Modifier.isStatic(method.getModifiers());
    if (!isStatic && target == null) {
      throw new IllegalArgumentException("Instance method requires a target: " + describe(method));
    }

    Signature signature = signatureOf(method);
    MethodHandle mh = unreflect(method);
    if (!isStatic) mh = mh.bindTo(target);

    return new MethodInvocable<>(method.getDeclaringClass().getSimpleName() + "#" + method.getName(), signature, mh);
  }

  /**
   * Looks up the single declared method named {@code methodName} on the target's class.
   */
  public static <R> Invocable<R> of(Object target, String methodName) {
    return of(target, findMethod(target.getClass(), methodName));
  }

  public static <R> Invocable<R> ofStatic(Class<?> type, String methodName) {
    return of(null, findMethod(type, methodName));
  }

  public static Signature signatureOf(Method method) {
    return SIGNATURES.computeIfAbsent(method, ReflectiveInvocables::readSignature);
  }

  /**
   * Shared instance of a producer class; one per class so that dependencies
   * naming the same class deduplicate.
   */
  @SuppressWarnings("unchecked")
  public static <T> Producer<T> producer(Class<? extends Producer<T>> type) {
    return (Producer<T>) PRODUCERS.computeIfAbsent(type, ReflectiveInvocables::instantiateProducer);
  }

  static void clear() {
    SIGNATURES.clear();
    PRODUCERS.clear();
  }

  // =========================================================================
  // Signature reading
  // =========================================================================

  private static Signature readSignature(Method method) {
    java.lang.reflect.Parameter[] params = method.getParameters();
    String[] names = new String[params.length];
    Dependency<?>[] defaults = new Dependency<?>[params.length];

    for (int i = 0; i < params.length; i++) {
      java.lang.reflect.Parameter p = params[i];
      names[i] = readName(p);

      Provided provided = p.getAnnotation(Provided.class);
      if (provided != null) {
        Producer<Object> producer = producerUnchecked(provided.value());
        defaults[i] = provided.shared() ? Shared.on(producer) : Depends.on(producer);
      }
    }

    List<List<Dependency<?>>> observed = readObserved(method, params);

    List<Parameter> out = new ArrayList<>(params.length);
    for (int i = 0; i < params.length; i++) {
      out.add(new Parameter(names[i], params[i].getType(), defaults[i], observed.get(i)));
    }
    return Signature.of(out);
  }

  /**
   * Unusable {@link Observed} metadata never fails the lookup: the method is then
   * treated as having no annotation dependencies at all.
   */
  private static List<List<Dependency<?>>> readObserved(Method method, java.lang.reflect.Parameter[] params) {
    List<List<Dependency<?>>> out = new ArrayList<>(params.length);
    try {
      for (java.lang.reflect.Parameter p : params) {
        List<Dependency<?>> deps = new ArrayList<>();
        for (Observed o : p.getAnnotationsByType(Observed.class)) {
          deps.add((Dependency<?>) instantiate(o.value()));
        }
        out.add(deps);
      }
      return out;
    } catch (RuntimeException e) {
      log.warn("Ignoring annotation dependencies of {}: {}", describe(method), e.toString());
      List<List<Dependency<?>>> none = new ArrayList<>(params.length);
      for (int i = 0; i < params.length; i++) none.add(List.of());
      return none;
    }
  }

  private static String readName(java.lang.reflect.Parameter p) {
    Named named = p.getAnnotation(Named.class);
    if (named != null && named.value() != null && !named.value().isBlank()) {
      return named.value().trim();
    }
    return p.getName();
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static Producer<Object> producerUnchecked(Class<? extends Producer> type) {
    return (Producer<Object>) PRODUCERS.computeIfAbsent(type, ReflectiveInvocables::instantiateProducer);
  }

  // =========================================================================
  // Construction
  // =========================================================================

  private static Producer<?> instantiateProducer(Class<?> type) {
    return (Producer<?>) instantiate(type);
  }

  private static <T> T instantiate(Class<T> type) {
    Constructor<?> ctor = findInjectConstructor(type);
    try {
      MethodHandles.Lookup lookup = MethodHandles.privateLookupIn(type, MethodHandles.lookup());
      MethodHandle mh = lookup.unreflectConstructor(ctor);
      return type.cast(mh.invoke());
    } catch (Throwable t) {
      if (t instanceof RuntimeException re) throw re;
      throw new IllegalStateException("Failed to instantiate " + type.getName(), t);
    }
  }

  private static Constructor<?> findInjectConstructor(Class<?> type) {
    Constructor<?> inject = null;
    for (Constructor<?> c : type.getDeclaredConstructors()) {
      if (c.isAnnotationPresent(Inject.class)) {
        if (inject != null) {
          throw new IllegalStateException("Multiple @Inject constructors in " + type.getName());
        }
        inject = c;
      }
    }

    if (inject == null) {
      try {
        inject = type.getDeclaredConstructor();
      } catch (NoSuchMethodException e) {
        throw new IllegalStateException("No @Inject or default constructor in " + type.getName(), e);
      }
    }

    if (inject.getParameterCount() != 0) {
      throw new IllegalStateException("Constructor of " + type.getName() + " must take no arguments: " + inject);
    }
    if (!inject.canAccess(null) && !inject.trySetAccessible()) {
      throw new IllegalStateException("Cannot access constructor of " + type.getName() + ": " + inject);
    }
    return inject;
  }

  private static MethodHandle unreflect(Method method) {
    try {
      MethodHandles.Lookup lookup = MethodHandles.privateLookupIn(method.getDeclaringClass(), MethodHandles.lookup());
      return lookup.unreflect(method);
    } catch (IllegalAccessException e) {
      throw new IllegalStateException("Cannot access method " + describe(method), e);
    }
  }

  private static Method findMethod(Class<?> type, String name) {
    Method found = null;
    for (Method m : type.getDeclaredMethods()) {
      if (m.isSynthetic() || m.isBridge() || !m.getName().equals(name)) continue;
      if (found != null) {
        throw new IllegalArgumentException("Ambiguous method name '" + name + "' in " + type.getName());
      }
      found = m;
    }
    if (found == null) {
      throw new IllegalArgumentException("No method '" + name + "' in " + type.getName());
    }
    return found;
  }

  private static String describe(Method m) {
    return m.getDeclaringClass().getName() + "#" + m.getName();
  }

  // =========================================================================
  // Invocation
  // =========================================================================

  private static final class MethodInvocable<R> implements Invocable<R> {
    private final String name;
    private final Signature signature;
    private final MethodHandle handle;

    MethodInvocable(String name, Signature signature, MethodHandle handle) {
      this.name = name;
      this.signature = signature;
      this.handle = handle;
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
    @SuppressWarnings("unchecked")
    public CompletionStage<R> invoke(Arguments arguments) {
      List<Parameter> params = signature.parameters();
      Object[] args = new Object[params.size()];
      for (int i = 0; i < args.length; i++) {
        args[i] = arguments.get(params.get(i).name());
      }

      final Object result;
      try {
        result = handle.invokeWithArguments(args);
      } catch (Throwable t) {
        if (t instanceof Error err) throw err;
        return CompletableFuture.failedFuture(t);
      }

      if (result instanceof CompletionStage<?> stage) {
        return (CompletionStage<R>) stage;
      }
      return CompletableFuture.completedFuture((R) result);
    }

    @Override
    public String toString() {
      return name + signature;
    }
  }
}

package ru.dimension.resolve;

import java.lang.annotation.*;

/**
 * Attaches an annotation dependency to a method parameter. The dependency is bound to
 * the parameter's final value and entered after all provided parameters are resolved.
 *
 * Used by {@link ReflectiveInvocables}.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(Observed.List.class)
@Documented
public @interface Observed {

  @SuppressWarnings("rawtypes")
  Class<? extends Dependency> value();

  @Target(ElementType.PARAMETER)
  @Retention(RetentionPolicy.RUNTIME)
  @Documented
  @interface List {
    Observed[] value();
  }
}

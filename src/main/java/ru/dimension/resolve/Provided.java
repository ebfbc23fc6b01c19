package ru.dimension.resolve;

import java.lang.annotation.*;

/**
 * Declares a method parameter as a dependency produced by the given {@link Producer} class.
 * The producer class is instantiated once, so every parameter naming it shares one
 * producer identity.
 *
 * Used by {@link ReflectiveInvocables}.
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Provided {

  @SuppressWarnings("rawtypes")
  Class<? extends Producer> value();

  /**
   * Resolve through the active {@link SharedContext} instead of per call.
   */
  boolean shared() default false;
}

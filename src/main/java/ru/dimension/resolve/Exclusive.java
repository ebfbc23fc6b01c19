package ru.dimension.resolve;

import java.lang.annotation.*;

/**
 * Marks a {@link Dependency} type as exclusive: a callable may declare at most one
 * dependency whose runtime type is, or inherits from, the marked type.
 *
 * The nearest declaration in the type hierarchy wins, so a subtype can opt out
 * with {@code @Exclusive(false)}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Exclusive {
  boolean value() default true;
}

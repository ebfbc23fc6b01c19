package ru.dimension.resolve;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.dimension.resolve.handlers.AuthGuard;
import ru.dimension.resolve.handlers.Backoff;
import ru.dimension.resolve.handlers.Deadline;
import ru.dimension.resolve.handlers.ExecutionLimit;
import ru.dimension.resolve.handlers.FailureHandler;
import ru.dimension.resolve.handlers.Guard;
import ru.dimension.resolve.handlers.Label;
import ru.dimension.resolve.handlers.LenientRetry;
import ru.dimension.resolve.handlers.RateGuard;
import ru.dimension.resolve.handlers.Retry;
import ru.dimension.resolve.handlers.Timeout;

class DependencyValidatorTest {

  private static String rejection(Signature signature) {
    return assertThrows(IllegalArgumentException.class, () -> DependencyValidator.validate(signature)).getMessage();
  }

  @Nested
  @DisplayName("Exclusivity lookup")
  class ExclusivityTests {

    @Test
    @DisplayName("Exclusivity is inherited from superclasses and interfaces")
    void inherited() {
      assertTrue(DependencyValidator.isExclusive(FailureHandler.class));
      assertTrue(DependencyValidator.isExclusive(Retry.class));
      assertTrue(DependencyValidator.isExclusive(Timeout.class));
      assertTrue(DependencyValidator.isExclusive(RateGuard.class));
      assertTrue(DependencyValidator.isExclusive(Backoff.class));
    }

    @Test
    @DisplayName("The nearest declaration wins")
    void nearestWins() {
      assertFalse(DependencyValidator.isExclusive(LenientRetry.class));
    }

    @Test
    @DisplayName("Plain dependencies are not exclusive")
    void plain() {
      assertFalse(DependencyValidator.isExclusive(Label.class));
      assertFalse(DependencyValidator.isExclusive(Depends.class));
    }

    @Test
    @DisplayName("Hierarchy lists classes before interfaces")
    void hierarchyOrder() {
      assertEquals(List.of(Retry.class, FailureHandler.class, Dependency.class),
          List.copyOf(DependencyValidator.hierarchy(Retry.class)));
      assertEquals(List.of(RateGuard.class, Guard.class, Dependency.class),
          List.copyOf(DependencyValidator.hierarchy(RateGuard.class)));
    }
  }

  @Nested
  @DisplayName("Default dependencies")
  class DefaultTests {

    @Test
    @DisplayName("Two instances of one exclusive type name the concrete type")
    void duplicateConcrete() {
      Signature signature = Signature.builder()
          .dependency("first", new Retry(1))
          .dependency("second", new Retry(3))
          .build();

      assertEquals("Only one Retry dependency is allowed", rejection(signature));
    }

    @Test
    @DisplayName("Siblings under one exclusive base name the base and every instance")
    void siblingsUnderBase() {
      Signature signature = Signature.builder()
          .dependency("retry", new Retry(2))
          .dependency("backoff", new Backoff())
          .build();

      assertEquals("Only one FailureHandler dependency is allowed, but found: Retry, Backoff", rejection(signature));
    }

    @Test
    @DisplayName("Execution limits conflict with each other")
    void executionLimits() {
      Signature signature = Signature.builder()
          .dependency("timeout", new Timeout())
          .dependency("deadline", new Deadline())
          .build();

      assertEquals("Only one " + ExecutionLimit.class.getSimpleName()
          + " dependency is allowed, but found: Timeout, Deadline", rejection(signature));
    }

    @Test
    @DisplayName("Exclusivity declared on an interface applies to implementations")
    void exclusiveInterface() {
      Signature signature = Signature.builder()
          .dependency("rate", new RateGuard())
          .dependency("auth", new AuthGuard())
          .build();

      assertEquals("Only one Guard dependency is allowed, but found: RateGuard, AuthGuard", rejection(signature));
    }

    @Test
    @DisplayName("Different exclusive families may be combined")
    void differentFamilies() {
      Signature signature = Signature.builder()
          .dependency("retry", new Retry(2))
          .dependency("timeout", new Timeout())
          .dependency("guard", new RateGuard())
          .build();

      assertDoesNotThrow(() -> DependencyValidator.validate(signature));
    }

    @Test
    @DisplayName("Non-exclusive dependencies may repeat")
    void nonExclusiveRepeat() {
      Producer<String> p = Producer.of(() -> "x");
      Signature signature = Signature.builder()
          .dependency("a", new Label("a"))
          .dependency("b", new Label("b"))
          .dependency("c", Depends.on(p))
          .dependency("d", Depends.on(p))
          .build();

      assertDoesNotThrow(() -> DependencyValidator.validate(signature));
    }

    @Test
    @DisplayName("An opted-out subtype still counts against its exclusive ancestors")
    void optOutStillCountsForAncestors() {
      Signature signature = Signature.builder()
          .dependency("lenient", new LenientRetry())
          .dependency("backoff", new Backoff())
          .build();

      assertEquals("Only one FailureHandler dependency is allowed, but found: LenientRetry, Backoff",
          rejection(signature));
    }

    @Test
    @DisplayName("Validating an invocable checks its signature")
    void validateInvocable() {
      Invocable<Void> fn = Invocable.of("handler", Signature.builder()
          .dependency("first", new Timeout())
          .dependency("second", new Timeout())
          .build(), args -> null);

      IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> DependencyValidator.validate(fn));
      assertEquals("Only one Timeout dependency is allowed", e.getMessage());
    }
  }

  @Nested
  @DisplayName("Annotation dependencies")
  class AnnotationTests {

    @Test
    @DisplayName("Two exclusive annotations of one type on a parameter are rejected")
    void duplicateOnSameParameter() {
      Signature signature = Signature.builder()
          .annotated("x", int.class, new Tracker(), new Tracker())
          .build();

      assertEquals("Only one Tracker annotation dependency is allowed per parameter, but found 2 on 'x'",
          rejection(signature));
    }

    @Test
    @DisplayName("One exclusive annotation per parameter is accepted on several parameters")
    void sameTypeOnDifferentParameters() {
      Signature signature = Signature.builder()
          .annotated("x", int.class, new Tracker())
          .annotated("y", String.class, new Tracker())
          .build();

      assertDoesNotThrow(() -> DependencyValidator.validate(signature));
    }

    @Test
    @DisplayName("An annotation does not conflict with a default of the same type")
    void annotationBesideDefault() {
      Signature signature = Signature.builder()
          .dependency("retry", new Retry(2))
          .annotated("payload", String.class, new Retry(5))
          .build();

      assertDoesNotThrow(() -> DependencyValidator.validate(signature));
    }

    @Test
    @DisplayName("Siblings under an exclusive base may annotate different parameters")
    void siblingsAcrossParameters() {
      Signature signature = Signature.builder()
          .annotated("a", String.class, new Timeout())
          .annotated("b", String.class, new Deadline())
          .build();

      assertDoesNotThrow(() -> DependencyValidator.validate(signature));
    }

    @Test
    @DisplayName("Defaults are still checked when annotations are present")
    void defaultsCheckedBesideAnnotations() {
      Signature signature = Signature.builder()
          .dependency("first", new Timeout())
          .dependency("second", new Deadline())
          .annotated("x", int.class, new Tracker())
          .build();

      assertTrue(rejection(signature).startsWith("Only one ExecutionLimit dependency is allowed"));
    }

    @Test
    @DisplayName("Non-exclusive annotations may repeat on one parameter")
    void nonExclusiveAnnotations() {
      Signature signature = Signature.builder()
          .annotated("a", String.class, new Label("x"), new Label("y"))
          .build();

      assertDoesNotThrow(() -> DependencyValidator.validate(signature));
    }
  }
}

package ru.dimension.resolve;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ArgumentsTest {

  @Test
  void keepsInsertionOrder() {
    Arguments args = Arguments.of("b", 2).with(Arguments.of("a", 1));

    assertEquals(List.of("b", "a"), List.copyOf(args.names()));
    assertEquals(2, args.size());
  }

  @Test
  void overridesWin() {
    Arguments resolved = Arguments.of(Map.of("x", "resolved", "y", "kept"));

    Arguments merged = resolved.with(Arguments.of("x", "caller"));

    assertEquals("caller", merged.get("x"));
    assertEquals("kept", merged.get("y"));
    assertEquals("resolved", resolved.get("x"));
  }

  @Test
  void nullValuesAllowed() {
    Map<String, Object> values = new HashMap<>();
    values.put("n", null);

    Arguments args = Arguments.of(values);

    assertTrue(args.contains("n"));
    assertNull(args.get("n", String.class));
  }

  @Test
  void typedAccessChecksType() {
    Arguments args = Arguments.of("n", 1);

    assertEquals(1, args.get("n", Integer.class));
    assertThrows(ClassCastException.class, () -> args.get("n", String.class));
  }

  @Test
  void failedDependencyAccess() {
    FailedDependency failed = new FailedDependency("db", new IllegalStateException("down"));
    Arguments args = Arguments.of("db", failed);

    assertSame(failed, args.get("db", FailedDependency.class));
    assertSame(failed, args.get("db"));
    IllegalStateException e = assertThrows(IllegalStateException.class, () -> args.get("db", Object.class));
    assertEquals("down", e.getCause().getMessage());
    assertEquals(List.of(failed), args.failures());
  }

  @Test
  void immutable() {
    Arguments args = Arguments.of("a", 1);

    assertThrows(UnsupportedOperationException.class, () -> args.asMap().put("b", 2));
  }

  @Test
  void equality() {
    assertEquals(Arguments.of("a", 1), Arguments.of(Map.of("a", 1)));
    assertSame(Arguments.empty(), Arguments.of(Map.of()));
  }
}

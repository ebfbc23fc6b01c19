package ru.dimension.resolve;

/**
 * Map key comparing the wrapped reference by identity, never by {@code equals}.
 */
final class IdentityKey {

  private final Object ref;

  IdentityKey(Object ref) {
    this.ref = ref;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof IdentityKey k && k.ref == ref;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(ref);
  }

  @Override
  public String toString() {
    return "IdentityKey{" + ref + "}";
  }
}

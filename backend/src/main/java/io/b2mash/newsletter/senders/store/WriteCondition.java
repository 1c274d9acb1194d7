package io.b2mash.newsletter.senders.store;

import java.util.Map;
import java.util.Objects;

/**
 * Precondition attached to a write. The write only takes effect if the stored item matches; the
 * store raises {@link ConditionalWriteFailedException} otherwise.
 */
public record WriteCondition(Existence existence, String attribute, Object expectedValue) {

  public enum Existence {
    ANY,
    ABSENT,
    PRESENT
  }

  private static final WriteCondition NONE = new WriteCondition(Existence.ANY, null, null);
  private static final WriteCondition ABSENT = new WriteCondition(Existence.ABSENT, null, null);
  private static final WriteCondition PRESENT = new WriteCondition(Existence.PRESENT, null, null);

  public WriteCondition {
    Objects.requireNonNull(existence, "existence");
    if (attribute != null && existence == Existence.ABSENT) {
      throw new IllegalArgumentException("An absent item has no attributes to compare");
    }
  }

  public static WriteCondition none() {
    return NONE;
  }

  public static WriteCondition itemAbsent() {
    return ABSENT;
  }

  public static WriteCondition itemPresent() {
    return PRESENT;
  }

  /** The item must exist and {@code attribute} must currently equal {@code expected}. */
  public static WriteCondition attributeEquals(String attribute, Object expected) {
    return new WriteCondition(
        Existence.PRESENT, Objects.requireNonNull(attribute), Objects.requireNonNull(expected));
  }

  public boolean isUnconditional() {
    return existence == Existence.ANY && attribute == null;
  }

  /**
   * Evaluates the condition against the currently stored attributes ({@code null} when the item
   * does not exist).
   */
  public boolean isSatisfiedBy(Map<String, Object> current) {
    switch (existence) {
      case ABSENT:
        return current == null;
      case PRESENT:
        if (current == null) {
          return false;
        }
        break;
      default:
        break;
    }
    if (attribute == null) {
      return true;
    }
    return current != null && valuesEqual(current.get(attribute), expectedValue);
  }

  private static boolean valuesEqual(Object stored, Object expected) {
    if (stored instanceof Number a && expected instanceof Number b) {
      return a.longValue() == b.longValue();
    }
    return Objects.equals(stored, expected);
  }
}

package org.a11yrag.retrieval_service.authority.model;

import java.util.Arrays;

/** Trust level of a source, from community content (1) to normative standards (5). */
public enum AuthorityLevel {
  COMMUNITY(1),
  PROFESSIONAL(2),
  PEER_REVIEWED(3),
  EXPERT_INTERPRETIVE(4),
  NORMATIVE(5);

  public static final int MAX = 5;

  private final int value;

  AuthorityLevel(int value) {
    this.value = value;
  }

  public int value() {
    return value;
  }

  /** Level divided by {@link #MAX}, in (0,1]. */
  public double normalized() {
    return (double) value / MAX;
  }

  /**
   * @throws IllegalArgumentException if the value is outside 1..5
   */
  public static AuthorityLevel fromValue(int value) {
    return Arrays.stream(values())
        .filter(level -> level.value == value)
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException("Authority level must be 1..5, got " + value));
  }
}

package io.intellixity.sqlbuddy.state;

public enum JoinType {
  INNER,
  LEFT,
  RIGHT,
  FULL;

  /** Keyword rendered before {@code JOIN}. */
  public String sql() { return name(); }

  /** Same join seen from the other side: LEFT and RIGHT swap, INNER and FULL are symmetric. */
  public JoinType mirrored() {
    return switch (this) {
      case LEFT -> RIGHT;
      case RIGHT -> LEFT;
      default -> this;
    };
  }
}

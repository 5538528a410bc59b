package io.intellixity.sqlbuddy.state;

public enum AggregateFunction {
  NONE,
  COUNT,
  SUM,
  AVG,
  MIN,
  MAX;

  public boolean isAggregate() { return this != NONE; }

  /** Lenient parse; null or blank is {@link #NONE}. */
  public static AggregateFunction parse(String s) {
    if (s == null || s.isBlank()) return NONE;
    return valueOf(s.trim().toUpperCase());
  }
}

package io.intellixity.sqlbuddy.state;

/** Filter operators; each carries its SQL token. */
public enum Operator {
  EQ("="),
  NE("!="),
  GT(">"),
  LT("<"),
  GE(">="),
  LE("<="),
  LIKE("LIKE"),
  ILIKE("ILIKE"),
  IN("IN"),
  IS_NULL("IS NULL", true),
  IS_NOT_NULL("IS NOT NULL", true);

  private final String sql;
  private final boolean unary;

  Operator(String sql) {
    this(sql, false);
  }

  Operator(String sql, boolean unary) {
    this.sql = sql;
    this.unary = unary;
  }

  public String sql() { return sql; }

  /** Unary operators ignore the filter value. */
  public boolean isUnary() { return unary; }

  public boolean isPattern() { return this == LIKE || this == ILIKE; }

  /** Accepts the SQL token ({@code "IS NOT NULL"}, {@code ">="}) or the constant name ({@code "IS_NOT_NULL"}). */
  public static Operator fromSql(String token) {
    if (token == null) throw new IllegalArgumentException("operator is null");
    String t = token.trim().replaceAll("\\s+", " ").toUpperCase();
    for (Operator op : values()) {
      if (op.sql.equals(t) || op.name().equals(t)) return op;
    }
    if (t.equals("<>")) return NE;
    throw new IllegalArgumentException("Unknown operator: " + token);
  }
}

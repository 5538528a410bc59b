package io.intellixity.sqlbuddy.state;

import io.intellixity.sqlbuddy.schema.TableId;

import java.util.Objects;

/** User-authored SELECT expression, rendered as {@code (<expression>) AS <alias>}. */
public record CalculatedColumn(String id, String alias, String expression) {
  public CalculatedColumn {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(alias, "alias");
    Objects.requireNonNull(expression, "expression");
  }

  /** Textual check only; the expression is opaque. */
  public boolean references(TableId table) {
    return expression.contains(table.columnPrefix());
  }
}

package io.intellixity.sqlbuddy.state;

import io.intellixity.sqlbuddy.schema.ColumnId;

import java.util.Objects;

/** A single conjunctive WHERE predicate. {@code value} is ignored for unary operators. */
public record Filter(String id, ColumnId column, Operator operator, String value) {
  public Filter {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(column, "column");
    operator = (operator == null) ? Operator.EQ : operator;
    value = (value == null) ? "" : value;
  }

  public Filter withOperator(Operator operator) { return new Filter(id, column, operator, value); }
  public Filter withValue(String value) { return new Filter(id, column, operator, value); }
}

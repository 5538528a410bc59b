package io.intellixity.sqlbuddy.state;

import io.intellixity.sqlbuddy.schema.ColumnId;

import java.util.Objects;

public record OrderByItem(String id, ColumnId column, Direction direction) {
  public OrderByItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(column, "column");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public OrderByItem withDirection(Direction direction) { return new OrderByItem(id, column, direction); }

  public enum Direction { ASC, DESC }
}

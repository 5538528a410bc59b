package io.intellixity.sqlbuddy.compile;

import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.TableId;
import io.intellixity.sqlbuddy.state.AggregateFunction;

import java.util.Objects;

/**
 * One table-derived entry of the SELECT list: either {@code table.*} or a (possibly aggregated) column.
 *
 * @param alias set only for aggregated columns
 */
public record SelectItem(TableId table, ColumnId column, AggregateFunction function, String alias) {
  public SelectItem {
    Objects.requireNonNull(table, "table");
    function = (function == null) ? AggregateFunction.NONE : function;
  }

  public static SelectItem wildcard(TableId table) {
    return new SelectItem(table, null, AggregateFunction.NONE, null);
  }

  public static SelectItem plain(ColumnId column) {
    return new SelectItem(column.table(), column, AggregateFunction.NONE, null);
  }

  public static SelectItem aggregated(ColumnId column, AggregateFunction fn, String alias) {
    return new SelectItem(column.table(), column, fn, alias);
  }

  public boolean isWildcard() { return column == null; }

  public boolean isAggregated() { return function.isAggregate(); }
}

package io.intellixity.sqlbuddy.spi.compile;

import io.intellixity.sqlbuddy.compile.ConsistencyException;
import io.intellixity.sqlbuddy.compile.EmptySelectionException;
import io.intellixity.sqlbuddy.compile.SelectionPlan;
import io.intellixity.sqlbuddy.compile.StructuralException;
import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.DatabaseSchema;
import io.intellixity.sqlbuddy.schema.TableId;
import io.intellixity.sqlbuddy.state.ExplicitJoin;
import io.intellixity.sqlbuddy.state.Filter;
import io.intellixity.sqlbuddy.state.OrderByItem;
import io.intellixity.sqlbuddy.state.QueryState;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Default, dialect-agnostic state validation.\n
 *
 * Validates:\n
 * - at least one selected table\n
 * - selected tables exist in the schema\n
 * - selected/aggregated/grouped/sorted/filtered columns belong to a selected table and exist\n
 * - joins connect two selected tables through two existing columns\n
 * - grouping: every plain output column and every sort column is grouped (or aggregated, for sorts)\n
 * - in GENERATE mode, a positive limit\n
 */
public final class DefaultStateValidationStrategy implements StateValidationStrategy {
  @Override
  public void validate(DatabaseSchema schema, QueryState state, CompileMode mode) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(mode, "mode");

    if (state.selectedTables().isEmpty()) throw new EmptySelectionException();

    validateStructure(schema, state);
    validateGrouping(schema, state);

    if (mode == CompileMode.GENERATE && state.limit() <= 0) {
      throw new ConsistencyException("LIMIT must be positive, got " + state.limit());
    }
  }

  private static void validateStructure(DatabaseSchema schema, QueryState state) {
    for (TableId t : state.selectedTables()) {
      if (!schema.hasTable(t)) {
        throw new StructuralException("Unknown table '" + t + "' in schema '" + schema.name() + "'");
      }
    }
    for (ColumnId c : state.selectedColumns()) requireColumn(schema, state, c, "select");
    for (ColumnId c : state.aggregations().keySet()) requireColumn(schema, state, c, "aggregation");
    for (ColumnId c : state.groupBy()) requireColumn(schema, state, c, "groupBy");
    for (OrderByItem o : state.orderBy()) requireColumn(schema, state, o.column(), "orderBy");
    for (Filter f : state.filters()) requireColumn(schema, state, f.column(), "filter");

    for (ExplicitJoin j : state.joins()) {
      if (j.fromColumn().isBlank() || j.toColumn().isBlank()) {
        throw new StructuralException(
            "Join between '" + j.fromTable() + "' and '" + j.toTable() + "' is missing a column");
      }
      requireColumn(schema, state, ColumnId.of(j.fromTable(), j.fromColumn()), "join");
      requireColumn(schema, state, ColumnId.of(j.toTable(), j.toColumn()), "join");
    }
  }

  private static void validateGrouping(DatabaseSchema schema, QueryState state) {
    SelectionPlan plan = SelectionPlan.of(schema, state);
    if (!plan.isGrouping()) return;

    Set<ColumnId> grouped = new HashSet<>(state.groupBy());
    for (ColumnId c : plan.plainColumns(schema)) {
      if (!grouped.contains(c)) {
        throw new ConsistencyException(
            "Column '" + c + "' must appear in GROUP BY or be used in an aggregate function");
      }
    }
    for (OrderByItem o : state.orderBy()) {
      ColumnId c = o.column();
      if (!grouped.contains(c) && !state.aggregationOf(c).isAggregate()) {
        throw new ConsistencyException(
            "Sort column '" + c + "' must appear in GROUP BY or be used in an aggregate function");
      }
    }
  }

  private static void requireColumn(DatabaseSchema schema, QueryState state, ColumnId c, String usage) {
    if (c == null) throw new StructuralException("Missing column in " + usage);
    if (!state.isTableSelected(c.table())) {
      throw new StructuralException(
          "Column '" + c + "' in " + usage + " references table '" + c.table() + "' which is not selected");
    }
    if (schema.column(c).isEmpty()) {
      throw new StructuralException("Unknown column '" + c + "' in " + usage);
    }
  }
}

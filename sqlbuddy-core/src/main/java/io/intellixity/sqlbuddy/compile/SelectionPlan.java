package io.intellixity.sqlbuddy.compile;

import io.intellixity.sqlbuddy.schema.ColumnDef;
import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.DatabaseSchema;
import io.intellixity.sqlbuddy.schema.TableDef;
import io.intellixity.sqlbuddy.schema.TableId;
import io.intellixity.sqlbuddy.state.AggregateFunction;
import io.intellixity.sqlbuddy.state.CalculatedColumn;
import io.intellixity.sqlbuddy.state.QueryState;

import java.util.*;

/**
 * Resolves the table-derived part of the SELECT list.\n
 *
 * Per selected table, in selection order:\n
 * - selected columns of the table, then aggregated columns of the table that are not listed\n
 * - with no selected column: {@code table.*}, unless the table has an aggregation or group-by column, in which
 *   case the schema columns are expanded so aggregated ones can be wrapped\n
 * - with no selected column but a calculated column referencing it: nothing (the formula stands in)\n
 *
 * Expects a structurally valid state (every referenced table selected and present in the schema).
 */
public final class SelectionPlan {
  private final List<SelectItem> items;
  private final boolean grouping;

  private SelectionPlan(List<SelectItem> items, boolean grouping) {
    this.items = List.copyOf(items);
    this.grouping = grouping;
  }

  public static SelectionPlan of(DatabaseSchema schema, QueryState state) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(state, "state");
    // Calculated columns keep the alias the user gave them; aggregates yield.
    Set<String> aliases = new HashSet<>();
    for (CalculatedColumn cc : state.calculatedColumns()) aliases.add(cc.alias());
    List<SelectItem> out = new ArrayList<>();

    for (TableId t : state.selectedTables()) {
      List<ColumnId> columns = new ArrayList<>();
      for (ColumnId c : state.selectedColumns()) if (c.belongsTo(t)) columns.add(c);

      if (columns.isEmpty()) {
        boolean aggregatedHere = state.aggregations().keySet().stream().anyMatch(c -> c.belongsTo(t));
        boolean groupedHere = state.groupBy().stream().anyMatch(c -> c.belongsTo(t));
        if (!aggregatedHere && !groupedHere) {
          boolean calculatedHere = state.calculatedColumns().stream().anyMatch(c -> c.references(t));
          if (!calculatedHere) out.add(SelectItem.wildcard(t));
          continue;
        }
        for (ColumnDef cd : tableOf(schema, t).columns()) columns.add(ColumnId.of(t, cd.name()));
      } else {
        for (ColumnId c : state.aggregations().keySet()) {
          if (c.belongsTo(t) && !columns.contains(c)) columns.add(c);
        }
      }

      for (ColumnId c : columns) {
        AggregateFunction fn = state.aggregationOf(c);
        out.add(fn.isAggregate() ? SelectItem.aggregated(c, fn, uniqueAlias(c, fn, aliases)) : SelectItem.plain(c));
      }
    }
    return new SelectionPlan(out, state.hasAggregations() || !state.groupBy().isEmpty());
  }

  public List<SelectItem> items() { return items; }

  /** True when the query aggregates or groups, so the grouping rule applies. */
  public boolean isGrouping() { return grouping; }

  /**
   * Columns that appear un-aggregated in the output, wildcards expanded through the schema.
   * These must all be grouped when {@link #isGrouping()}.
   */
  public List<ColumnId> plainColumns(DatabaseSchema schema) {
    List<ColumnId> out = new ArrayList<>();
    for (SelectItem i : items) {
      if (i.isAggregated()) continue;
      if (i.isWildcard()) {
        for (ColumnDef cd : tableOf(schema, i.table()).columns()) out.add(ColumnId.of(i.table(), cd.name()));
      } else {
        out.add(i.column());
      }
    }
    return out;
  }

  // amount_sum, then orders_amount_sum, then orders_amount_sum_2 ...
  private static String uniqueAlias(ColumnId c, AggregateFunction fn, Set<String> used) {
    String fnName = fn.name().toLowerCase(Locale.ROOT);
    String alias = c.column() + "_" + fnName;
    if (used.add(alias)) return alias;
    String qualified = c.table().name() + "_" + c.column() + "_" + fnName;
    if (used.add(qualified)) return qualified;
    for (int n = 2; ; n++) {
      String candidate = qualified + "_" + n;
      if (used.add(candidate)) return candidate;
    }
  }

  private static TableDef tableOf(DatabaseSchema schema, TableId t) {
    return schema.table(t).orElseThrow(() -> new StructuralException("Unknown table '" + t + "' in schema"));
  }
}

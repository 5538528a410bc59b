package io.intellixity.sqlbuddy.state;

import io.intellixity.sqlbuddy.compile.StructuralException;
import io.intellixity.sqlbuddy.formula.ExpressionValidationException;
import io.intellixity.sqlbuddy.formula.ExpressionValidator;
import io.intellixity.sqlbuddy.schema.ColumnDef;
import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.DatabaseSchema;
import io.intellixity.sqlbuddy.schema.TableDef;
import io.intellixity.sqlbuddy.schema.TableId;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * The legal transitions between {@link QueryState} values.\n
 *
 * Each method is total over a consistent input and returns a new consistent state; the input is never
 * modified. Table removal cascades here and nowhere else. References to tables outside the selection are
 * rejected with {@link StructuralException}.
 */
public final class QueryStateMutations {
  private QueryStateMutations() {}

  // ---------- tables ----------

  public static QueryState addTable(QueryState s, TableId table) {
    Objects.requireNonNull(table, "table");
    if (s.isTableSelected(table)) return s;
    return s.withSelectedTables(append(s.selectedTables(), table));
  }

  /**
   * Removes the table and everything that mentions it: columns, aggregations, group-by, sorts, joins, filters
   * and calculated columns whose expression references it.
   */
  public static QueryState removeTable(QueryState s, TableId table) {
    Objects.requireNonNull(table, "table");
    if (!s.isTableSelected(table)) return s;

    Map<ColumnId, AggregateFunction> aggs = new LinkedHashMap<>(s.aggregations());
    aggs.keySet().removeIf(c -> c.belongsTo(table));

    return s.withSelectedTables(without(s.selectedTables(), t -> t.equals(table)))
        .withSelectedColumns(without(s.selectedColumns(), c -> c.belongsTo(table)))
        .withAggregations(aggs)
        .withGroupBy(without(s.groupBy(), c -> c.belongsTo(table)))
        .withOrderBy(without(s.orderBy(), o -> o.column().belongsTo(table)))
        .withJoins(without(s.joins(), j -> j.mentions(table)))
        .withFilters(without(s.filters(), f -> f.column().belongsTo(table)))
        .withCalculatedColumns(without(s.calculatedColumns(), c -> c.references(table)));
  }

  public static QueryState toggleTable(QueryState s, TableId table) {
    return s.isTableSelected(table) ? removeTable(s, table) : addTable(s, table);
  }

  /** Empties the selection; only the limit survives. */
  public static QueryState clearAllTables(QueryState s) {
    return QueryState.empty(s.limit());
  }

  // ---------- columns & aggregation ----------

  /** Idempotent select; implicitly adds the column's table. */
  public static QueryState selectColumn(QueryState s, ColumnId column) {
    Objects.requireNonNull(column, "column");
    QueryState withTable = addTable(s, column.table());
    if (withTable.selectedColumns().contains(column)) return withTable;
    return withTable.withSelectedColumns(append(withTable.selectedColumns(), column));
  }

  /** Deselecting also drops the column's aggregation. */
  public static QueryState deselectColumn(QueryState s, ColumnId column) {
    Objects.requireNonNull(column, "column");
    Map<ColumnId, AggregateFunction> aggs = new LinkedHashMap<>(s.aggregations());
    aggs.remove(column);
    return s.withSelectedColumns(without(s.selectedColumns(), c -> c.equals(column))).withAggregations(aggs);
  }

  public static QueryState toggleColumn(QueryState s, ColumnId column) {
    return s.selectedColumns().contains(column) ? deselectColumn(s, column) : selectColumn(s, column);
  }

  /** Selects every column the schema lists for {@code table}, in schema order. */
  public static QueryState selectAllColumns(DatabaseSchema schema, QueryState s, TableId table) {
    TableDef def = schema.table(table)
        .orElseThrow(() -> new StructuralException("Unknown table '" + table + "' in schema '" + schema.name() + "'"));
    QueryState out = addTable(s, table);
    for (ColumnDef c : def.columns()) out = selectColumn(out, ColumnId.of(table, c.name()));
    return out;
  }

  /** Deselects the given columns of {@code table} (and their aggregations); the table stays selected. */
  public static QueryState selectNoneColumns(QueryState s, TableId table, Collection<String> columnNames) {
    Set<ColumnId> drop = new HashSet<>();
    for (String name : columnNames) drop.add(ColumnId.of(table, name));
    Map<ColumnId, AggregateFunction> aggs = new LinkedHashMap<>(s.aggregations());
    aggs.keySet().removeAll(drop);
    return s.withSelectedColumns(without(s.selectedColumns(), drop::contains)).withAggregations(aggs);
  }

  public static QueryState selectNoneColumns(QueryState s, TableId table) {
    Map<ColumnId, AggregateFunction> aggs = new LinkedHashMap<>(s.aggregations());
    aggs.keySet().removeIf(c -> c.belongsTo(table));
    return s.withSelectedColumns(without(s.selectedColumns(), c -> c.belongsTo(table))).withAggregations(aggs);
  }

  /** {@code NONE} removes the entry; any other function also selects the column. */
  public static QueryState setAggregation(QueryState s, ColumnId column, AggregateFunction fn) {
    Objects.requireNonNull(column, "column");
    Map<ColumnId, AggregateFunction> aggs = new LinkedHashMap<>(s.aggregations());
    if (fn == null || !fn.isAggregate()) {
      aggs.remove(column);
      return s.withAggregations(aggs);
    }
    aggs.put(column, fn);
    return selectColumn(s, column).withAggregations(aggs);
  }

  // ---------- joins ----------

  public static QueryState addJoin(QueryState s, TableId from, String fromColumn, JoinType type,
                                   TableId to, String toColumn) {
    return addJoin(s, new ExplicitJoin(newId(), from, fromColumn, type, to, toColumn));
  }

  /** Also the way an accepted join suggestion enters the state. */
  public static QueryState addJoin(QueryState s, ExplicitJoin join) {
    Objects.requireNonNull(join, "join");
    requireSelected(s, join.fromTable(), "join " + join.id());
    requireSelected(s, join.toTable(), "join " + join.id());
    for (ExplicitJoin j : s.joins()) {
      if (j.id().equals(join.id())) throw new IllegalArgumentException("Duplicate join id: " + join.id());
    }
    return s.withJoins(append(s.joins(), join));
  }

  public static QueryState updateJoin(QueryState s, ExplicitJoin updated) {
    Objects.requireNonNull(updated, "updated");
    requireSelected(s, updated.fromTable(), "join " + updated.id());
    requireSelected(s, updated.toTable(), "join " + updated.id());
    return s.withJoins(replaceById(s.joins(), updated.id(), ExplicitJoin::id, j -> updated, "join"));
  }

  public static QueryState removeJoin(QueryState s, String joinId) {
    return s.withJoins(without(s.joins(), j -> j.id().equals(joinId)));
  }

  // ---------- filters ----------

  public static QueryState addFilter(QueryState s, ColumnId column, Operator operator, String value) {
    return addFilter(s, new Filter(newId(), column, operator, value));
  }

  public static QueryState addFilter(QueryState s, Filter filter) {
    Objects.requireNonNull(filter, "filter");
    requireSelected(s, filter.column().table(), "filter on " + filter.column());
    return s.withFilters(append(s.filters(), filter));
  }

  public static QueryState updateFilter(QueryState s, Filter updated) {
    Objects.requireNonNull(updated, "updated");
    requireSelected(s, updated.column().table(), "filter on " + updated.column());
    return s.withFilters(replaceById(s.filters(), updated.id(), Filter::id, f -> updated, "filter"));
  }

  public static QueryState removeFilter(QueryState s, String filterId) {
    return s.withFilters(without(s.filters(), f -> f.id().equals(filterId)));
  }

  // ---------- grouping & ordering ----------

  public static QueryState toggleGroupBy(QueryState s, ColumnId column) {
    Objects.requireNonNull(column, "column");
    if (s.groupBy().contains(column)) return s.withGroupBy(without(s.groupBy(), c -> c.equals(column)));
    requireSelected(s, column.table(), "group by " + column);
    return s.withGroupBy(append(s.groupBy(), column));
  }

  public static QueryState addSort(QueryState s, ColumnId column, OrderByItem.Direction direction) {
    return addSort(s, new OrderByItem(newId(), column, direction));
  }

  public static QueryState addSort(QueryState s, OrderByItem item) {
    Objects.requireNonNull(item, "item");
    requireSelected(s, item.column().table(), "order by " + item.column());
    return s.withOrderBy(append(s.orderBy(), item));
  }

  public static QueryState updateSort(QueryState s, OrderByItem updated) {
    Objects.requireNonNull(updated, "updated");
    requireSelected(s, updated.column().table(), "order by " + updated.column());
    return s.withOrderBy(replaceById(s.orderBy(), updated.id(), OrderByItem::id, o -> updated, "sort"));
  }

  public static QueryState removeSort(QueryState s, String sortId) {
    return s.withOrderBy(without(s.orderBy(), o -> o.id().equals(sortId)));
  }

  // ---------- calculated columns & limit ----------

  /**
   * Validates the formula, sanitizes the alias and appends the column.
   *
   * @throws ExpressionValidationException if the formula is rejected or the alias is already used
   */
  public static QueryState addCalculatedColumn(QueryState s, String alias, String expression) {
    ExpressionValidator.validate(alias, expression);
    return addCalculatedColumn(s, new CalculatedColumn(newId(), alias, expression));
  }

  /** Same checks as {@link #addCalculatedColumn(QueryState, String, String)}; keeps the column's id. */
  public static QueryState addCalculatedColumn(QueryState s, CalculatedColumn column) {
    Objects.requireNonNull(column, "column");
    ExpressionValidator.validate(column.alias(), column.expression());
    String clean = ExpressionValidator.sanitizeAlias(column.alias());
    for (CalculatedColumn c : s.calculatedColumns()) {
      if (c.alias().equals(clean)) throw new ExpressionValidationException("Duplicate calculated column alias: " + clean);
    }
    CalculatedColumn accepted = new CalculatedColumn(column.id(), clean, column.expression().trim());
    return s.withCalculatedColumns(append(s.calculatedColumns(), accepted));
  }

  public static QueryState removeCalculatedColumn(QueryState s, String id) {
    return s.withCalculatedColumns(without(s.calculatedColumns(), c -> c.id().equals(id)));
  }

  public static QueryState setLimit(QueryState s, int limit) {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    return s.withLimit(limit);
  }

  // ---------- helpers ----------

  static String newId() { return UUID.randomUUID().toString(); }

  private static void requireSelected(QueryState s, TableId table, String usage) {
    if (!s.isTableSelected(table)) {
      throw new StructuralException("Table '" + table + "' referenced by " + usage + " is not selected");
    }
  }

  private static <T> List<T> append(List<T> in, T item) {
    List<T> out = new ArrayList<>(in.size() + 1);
    out.addAll(in);
    out.add(item);
    return out;
  }

  private static <T> List<T> without(List<T> in, Predicate<T> drop) {
    List<T> out = new ArrayList<>(in.size());
    for (T t : in) if (!drop.test(t)) out.add(t);
    return out;
  }

  private static <T> List<T> replaceById(List<T> in, String id, Function<T, String> idOf,
                                         UnaryOperator<T> replace, String kind) {
    List<T> out = new ArrayList<>(in.size());
    boolean found = false;
    for (T t : in) {
      if (idOf.apply(t).equals(id)) {
        out.add(replace.apply(t));
        found = true;
      } else {
        out.add(t);
      }
    }
    if (!found) throw new IllegalArgumentException("Unknown " + kind + " id: " + id);
    return out;
  }
}

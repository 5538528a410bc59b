package io.intellixity.sqlbuddy.state;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.TableId;

import java.util.*;

/**
 * Serializable description of a query under construction.\n
 *
 * Immutable: every {@code withX} returns a new instance so callers can keep exact snapshots.
 * Structural consistency is maintained by {@link QueryStateMutations}; this class only de-duplicates
 * the set-like fields and drops {@link AggregateFunction#NONE} entries.
 */
@JsonSerialize(using = QueryStateJsonSerializer.class)
@JsonDeserialize(using = QueryStateJsonDeserializer.class)
public final class QueryState {
  public static final int DEFAULT_LIMIT = 100;

  private final List<TableId> selectedTables;
  private final List<ColumnId> selectedColumns;
  private final Map<ColumnId, AggregateFunction> aggregations;
  private final List<ExplicitJoin> joins;
  private final List<Filter> filters;
  private final List<ColumnId> groupBy;
  private final List<OrderByItem> orderBy;
  private final List<CalculatedColumn> calculatedColumns;
  private final int limit;

  private QueryState(List<TableId> selectedTables,
                     List<ColumnId> selectedColumns,
                     Map<ColumnId, AggregateFunction> aggregations,
                     List<ExplicitJoin> joins,
                     List<Filter> filters,
                     List<ColumnId> groupBy,
                     List<OrderByItem> orderBy,
                     List<CalculatedColumn> calculatedColumns,
                     int limit) {
    this.selectedTables = distinct(selectedTables);
    this.selectedColumns = distinct(selectedColumns);
    Map<ColumnId, AggregateFunction> aggs = new LinkedHashMap<>();
    if (aggregations != null) {
      aggregations.forEach((k, v) -> {
        if (k != null && v != null && v.isAggregate()) aggs.put(k, v);
      });
    }
    this.aggregations = Collections.unmodifiableMap(aggs);
    this.joins = List.copyOf(joins == null ? List.of() : joins);
    this.filters = List.copyOf(filters == null ? List.of() : filters);
    this.groupBy = distinct(groupBy);
    this.orderBy = List.copyOf(orderBy == null ? List.of() : orderBy);
    this.calculatedColumns = List.copyOf(calculatedColumns == null ? List.of() : calculatedColumns);
    this.limit = limit;
  }

  public static QueryState empty() { return empty(DEFAULT_LIMIT); }

  public static QueryState empty(int limit) {
    return new QueryState(null, null, null, null, null, null, null, null, limit);
  }

  /** Ordered set; the first entry is the FROM table. */
  public List<TableId> selectedTables() { return selectedTables; }
  public List<ColumnId> selectedColumns() { return selectedColumns; }
  public Map<ColumnId, AggregateFunction> aggregations() { return aggregations; }
  public List<ExplicitJoin> joins() { return joins; }
  public List<Filter> filters() { return filters; }
  public List<ColumnId> groupBy() { return groupBy; }
  public List<OrderByItem> orderBy() { return orderBy; }
  public List<CalculatedColumn> calculatedColumns() { return calculatedColumns; }
  public int limit() { return limit; }

  public AggregateFunction aggregationOf(ColumnId column) {
    return aggregations.getOrDefault(column, AggregateFunction.NONE);
  }

  public boolean isTableSelected(TableId table) { return selectedTables.contains(table); }

  public boolean hasAggregations() { return !aggregations.isEmpty(); }

  public QueryState withSelectedTables(List<TableId> v) {
    return new QueryState(v, selectedColumns, aggregations, joins, filters, groupBy, orderBy, calculatedColumns, limit);
  }

  public QueryState withSelectedColumns(List<ColumnId> v) {
    return new QueryState(selectedTables, v, aggregations, joins, filters, groupBy, orderBy, calculatedColumns, limit);
  }

  public QueryState withAggregations(Map<ColumnId, AggregateFunction> v) {
    return new QueryState(selectedTables, selectedColumns, v, joins, filters, groupBy, orderBy, calculatedColumns, limit);
  }

  public QueryState withJoins(List<ExplicitJoin> v) {
    return new QueryState(selectedTables, selectedColumns, aggregations, v, filters, groupBy, orderBy, calculatedColumns, limit);
  }

  public QueryState withFilters(List<Filter> v) {
    return new QueryState(selectedTables, selectedColumns, aggregations, joins, v, groupBy, orderBy, calculatedColumns, limit);
  }

  public QueryState withGroupBy(List<ColumnId> v) {
    return new QueryState(selectedTables, selectedColumns, aggregations, joins, filters, v, orderBy, calculatedColumns, limit);
  }

  public QueryState withOrderBy(List<OrderByItem> v) {
    return new QueryState(selectedTables, selectedColumns, aggregations, joins, filters, groupBy, v, calculatedColumns, limit);
  }

  public QueryState withCalculatedColumns(List<CalculatedColumn> v) {
    return new QueryState(selectedTables, selectedColumns, aggregations, joins, filters, groupBy, orderBy, v, limit);
  }

  public QueryState withLimit(int v) {
    return new QueryState(selectedTables, selectedColumns, aggregations, joins, filters, groupBy, orderBy, calculatedColumns, v);
  }

  private static <T> List<T> distinct(List<T> in) {
    if (in == null || in.isEmpty()) return List.of();
    LinkedHashSet<T> uniq = new LinkedHashSet<>();
    for (T t : in) if (t != null) uniq.add(t);
    return List.copyOf(uniq);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof QueryState q)) return false;
    return limit == q.limit
        && selectedTables.equals(q.selectedTables)
        && selectedColumns.equals(q.selectedColumns)
        && aggregations.equals(q.aggregations)
        && joins.equals(q.joins)
        && filters.equals(q.filters)
        && groupBy.equals(q.groupBy)
        && orderBy.equals(q.orderBy)
        && calculatedColumns.equals(q.calculatedColumns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(selectedTables, selectedColumns, aggregations, joins, filters, groupBy, orderBy,
        calculatedColumns, limit);
  }

  @Override
  public String toString() {
    return "QueryState{tables=" + selectedTables + ", columns=" + selectedColumns + ", aggregations=" + aggregations
        + ", joins=" + joins.size() + ", filters=" + filters.size() + ", groupBy=" + groupBy
        + ", orderBy=" + orderBy.size() + ", calculated=" + calculatedColumns.size() + ", limit=" + limit + "}";
  }
}

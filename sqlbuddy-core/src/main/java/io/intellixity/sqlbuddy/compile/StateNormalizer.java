package io.intellixity.sqlbuddy.compile;

import io.intellixity.sqlbuddy.formula.ExpressionValidationException;
import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.DatabaseSchema;
import io.intellixity.sqlbuddy.schema.TableId;
import io.intellixity.sqlbuddy.state.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Replays an untrusted candidate state through {@link QueryStateMutations}.
 * <p>
 * Candidates come from external producers (saved documents, natural-language generators). Items that would
 * break a structural invariant are dropped rather than rejected; what survives is a state the mutation layer
 * itself could have produced. Grouping consistency is left to the compiler.
 */
public final class StateNormalizer {
  private static final Logger log = LoggerFactory.getLogger(StateNormalizer.class);

  private final DatabaseSchema schema;
  private final int defaultLimit;

  public StateNormalizer(DatabaseSchema schema) {
    this(schema, QueryState.DEFAULT_LIMIT);
  }

  public StateNormalizer(DatabaseSchema schema, int defaultLimit) {
    this.schema = Objects.requireNonNull(schema, "schema");
    if (defaultLimit <= 0) throw new IllegalArgumentException("defaultLimit must be > 0");
    this.defaultLimit = defaultLimit;
  }

  public QueryState normalize(QueryState candidate) {
    if (candidate == null) return QueryState.empty(defaultLimit);
    QueryState out = QueryState.empty(candidate.limit() > 0 ? candidate.limit() : defaultLimit);

    List<TableId> droppedTables = new ArrayList<>();
    for (TableId t : candidate.selectedTables()) {
      if (schema.hasTable(t)) {
        out = QueryStateMutations.addTable(out, t);
      } else {
        droppedTables.add(t);
        dropped("table", t);
      }
    }
    for (ColumnId c : candidate.selectedColumns()) {
      if (knownColumn(out, c)) out = QueryStateMutations.selectColumn(out, c);
      else dropped("column", c);
    }
    for (Map.Entry<ColumnId, AggregateFunction> e : candidate.aggregations().entrySet()) {
      if (knownColumn(out, e.getKey())) out = QueryStateMutations.setAggregation(out, e.getKey(), e.getValue());
      else dropped("aggregation", e.getKey());
    }
    for (ExplicitJoin j : candidate.joins()) {
      boolean ok = out.isTableSelected(j.fromTable()) && out.isTableSelected(j.toTable())
          && hasColumn(j.fromTable(), j.fromColumn())
          && hasColumn(j.toTable(), j.toColumn());
      if (ok && out.joins().stream().noneMatch(x -> x.id().equals(j.id()))) out = QueryStateMutations.addJoin(out, j);
      else dropped("join", j);
    }
    for (Filter f : candidate.filters()) {
      if (knownColumn(out, f.column())) out = QueryStateMutations.addFilter(out, f);
      else dropped("filter", f);
    }
    for (ColumnId g : candidate.groupBy()) {
      if (knownColumn(out, g)) out = QueryStateMutations.toggleGroupBy(out, g);
      else dropped("groupBy", g);
    }
    for (OrderByItem o : candidate.orderBy()) {
      if (knownColumn(out, o.column())) out = QueryStateMutations.addSort(out, o);
      else dropped("orderBy", o);
    }
    for (CalculatedColumn c : candidate.calculatedColumns()) {
      if (droppedTables.stream().anyMatch(c::references)) {
        dropped("calculatedColumn", c);
        continue;
      }
      try {
        out = QueryStateMutations.addCalculatedColumn(out, c);
      } catch (ExpressionValidationException e) {
        log.debug("sqlbuddy.normalize dropped kind=calculatedColumn alias={} reason={}", c.alias(), e.getMessage());
      }
    }
    return out;
  }

  // Only columns on already-kept tables; a candidate column never drags in a table the candidate did not select.
  private boolean knownColumn(QueryState s, ColumnId c) {
    return s.isTableSelected(c.table()) && schema.column(c).isPresent();
  }

  private boolean hasColumn(TableId t, String column) {
    return !column.isBlank() && schema.table(t).map(d -> d.hasColumn(column)).orElse(false);
  }

  private static void dropped(String kind, Object item) {
    log.debug("sqlbuddy.normalize dropped kind={} item={}", kind, item);
  }
}

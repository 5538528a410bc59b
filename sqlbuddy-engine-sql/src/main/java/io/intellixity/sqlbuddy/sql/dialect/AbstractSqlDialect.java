package io.intellixity.sqlbuddy.sql.dialect;

import io.intellixity.sqlbuddy.compile.ColumnTypeResolver;
import io.intellixity.sqlbuddy.compile.ConsistencyException;
import io.intellixity.sqlbuddy.compile.SelectItem;
import io.intellixity.sqlbuddy.compile.SelectionPlan;
import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.DatabaseSchema;
import io.intellixity.sqlbuddy.schema.TableId;
import io.intellixity.sqlbuddy.spi.compile.CompileMode;
import io.intellixity.sqlbuddy.spi.compile.CompilerOptions;
import io.intellixity.sqlbuddy.spi.sql.CompiledSql;
import io.intellixity.sqlbuddy.spi.sql.Dialect;
import io.intellixity.sqlbuddy.state.AggregateFunction;
import io.intellixity.sqlbuddy.state.CalculatedColumn;
import io.intellixity.sqlbuddy.state.ExplicitJoin;
import io.intellixity.sqlbuddy.state.Filter;
import io.intellixity.sqlbuddy.state.JoinType;
import io.intellixity.sqlbuddy.state.Operator;
import io.intellixity.sqlbuddy.state.OrderByItem;
import io.intellixity.sqlbuddy.state.QueryState;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Generic SQL dialect base.\n
 *
 * Renders, in clause order:\n
 * - SELECT: per-table wildcards / columns / aggregates, then calculated columns\n
 * - FROM / JOIN: base table, joins in insertion order, unconnected tables as CROSS JOIN (with a warning)\n
 * - WHERE: conjunctive filters with inline literals\n
 * - GROUP BY, ORDER BY, LIMIT\n
 *
 * DB-specific dialects override hooks for identifier quoting and pattern matching.\n
 */
public abstract class AbstractSqlDialect implements Dialect {
  private static final Pattern NUMERIC = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][-+]?\\d+)?");

  protected static final class RenderCtx {
    private final DatabaseSchema schema;
    private final ColumnTypeResolver types;
    private final List<String> warnings = new ArrayList<>();

    RenderCtx(DatabaseSchema schema) {
      this.schema = schema;
      this.types = new ColumnTypeResolver(schema);
    }

    public DatabaseSchema schema() { return schema; }
    public ColumnTypeResolver types() { return types; }
    public void warn(String w) { warnings.add(w); }
  }

  @Override
  public final CompiledSql render(DatabaseSchema schema, QueryState state, CompileMode mode, CompilerOptions options) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(options, "options");
    RenderCtx ctx = new RenderCtx(schema);
    SelectionPlan plan = SelectionPlan.of(schema, state);

    List<String> clauses = new ArrayList<>();
    clauses.add("SELECT " + renderSelectList(plan, state.calculatedColumns()));
    clauses.addAll(renderFrom(state, ctx));

    if (!state.filters().isEmpty()) {
      List<String> preds = new ArrayList<>();
      for (Filter f : state.filters()) preds.add(renderFilter(f, ctx));
      clauses.add("WHERE " + String.join(" AND ", preds));
    }
    if (!state.groupBy().isEmpty()) {
      clauses.add("GROUP BY " + String.join(", ", state.groupBy().stream().map(this::column).toList()));
    }
    if (!state.orderBy().isEmpty()) {
      List<String> items = new ArrayList<>();
      for (OrderByItem o : state.orderBy()) items.add(renderSortExpr(o, state) + " " + o.direction().name());
      clauses.add("ORDER BY " + String.join(", ", items));
    }
    if (state.limit() > 0) clauses.add(renderLimit(state.limit()));

    String sql = String.join(options.multiline() ? "\n" : " ", clauses);
    if (options.terminateStatement()) sql = sql + ";";
    return new CompiledSql(sql, ctx.warnings);
  }

  protected String renderSelectList(SelectionPlan plan, List<CalculatedColumn> calculated) {
    List<String> items = new ArrayList<>();
    for (SelectItem i : plan.items()) {
      if (i.isWildcard()) items.add(table(i.table()) + ".*");
      else if (i.isAggregated()) items.add(aggregate(i.function(), i.column()) + " AS " + quoteIdent(i.alias()));
      else items.add(column(i.column()));
    }
    for (CalculatedColumn cc : calculated) {
      items.add("(" + cc.expression() + ") AS " + quoteIdent(cc.alias()));
    }
    return String.join(", ", items);
  }

  /**
   * FROM clause followed by one entry per JOIN.\n
   *
   * Joins are taken in insertion order. A join whose tables are both outside the current scope waits until
   * one side is reachable; if neither ever is, the next unconnected selected table is brought in with a CROSS
   * JOIN and planning resumes.\n
   *
   * A join between two tables already in scope (a composite key) adds its condition to the ON clause of the
   * JOIN that brought the later of the two in.
   */
  protected List<String> renderFrom(QueryState state, RenderCtx ctx) {
    List<TableId> selected = state.selectedTables();
    TableId base = selected.get(0);
    Set<TableId> scope = new LinkedHashSet<>();
    scope.add(base);

    List<String> out = new ArrayList<>();
    out.add("FROM " + table(base));
    // table -> index in out of the JOIN ... ON clause that brought it in
    Map<TableId, Integer> joinedAt = new HashMap<>();
    List<ExplicitJoin> pending = new ArrayList<>(state.joins());

    while (true) {
      boolean progress = true;
      while (progress) {
        progress = false;
        for (Iterator<ExplicitJoin> it = pending.iterator(); it.hasNext(); ) {
          ExplicitJoin j = it.next();
          boolean fromIn = scope.contains(j.fromTable());
          boolean toIn = scope.contains(j.toTable());
          if (fromIn && toIn) {
            int at = Math.max(joinedAt.getOrDefault(j.fromTable(), -1), joinedAt.getOrDefault(j.toTable(), -1));
            if (at < 0) {
              throw new ConsistencyException("Join '" + j.id() + "' between '" + j.fromTable() + "' and '"
                  + j.toTable() + "' has no JOIN clause to extend");
            }
            out.set(at, out.get(at) + " AND " + joinCondition(j));
            it.remove();
            continue;
          }
          if (!fromIn && !toIn) continue;
          TableId joined = fromIn ? j.toTable() : j.fromTable();
          JoinType type = fromIn ? j.type() : j.type().mirrored();
          out.add(type.sql() + " JOIN " + table(joined) + " ON " + joinCondition(j));
          joinedAt.put(joined, out.size() - 1);
          scope.add(joined);
          it.remove();
          progress = true;
          break;
        }
      }

      TableId loose = null;
      for (TableId t : selected) {
        if (!scope.contains(t)) {
          loose = t;
          break;
        }
      }
      if (loose == null) break;
      ctx.warn("Table '" + loose + "' is not joined to '" + base + "'; emitted as CROSS JOIN");
      out.add("CROSS JOIN " + table(loose));
      scope.add(loose);
    }
    return out;
  }

  protected String joinCondition(ExplicitJoin j) {
    return column(ColumnId.of(j.fromTable(), j.fromColumn())) + " = " + column(ColumnId.of(j.toTable(), j.toColumn()));
  }

  protected String renderFilter(Filter f, RenderCtx ctx) {
    String col = column(f.column());
    Operator op = f.operator();
    if (op.isUnary()) return col + " " + op.sql();
    if (op == Operator.IN) {
      List<String> items = new ArrayList<>();
      for (String raw : f.value().split(",")) {
        String v = raw.strip();
        if (!v.isEmpty()) items.add(literal(v, f.column(), ctx));
      }
      if (items.isEmpty()) {
        throw new ConsistencyException("Filter IN on '" + f.column() + "' has no values");
      }
      return col + " IN (" + String.join(", ", items) + ")";
    }
    if (op.isPattern()) {
      String v = f.value().strip();
      return renderPattern(patternOperand(f.column(), ctx), op, isParameter(v) ? v : quote(f.value()));
    }
    return col + " " + op.sql() + " " + literal(f.value(), f.column(), ctx);
  }

  /** Left-hand side of {@code LIKE} / {@code ILIKE}. Non-text columns are matched on their text form. */
  protected String patternOperand(ColumnId c, RenderCtx ctx) {
    return ctx.types().isTextual(c) ? column(c) : "CAST(" + column(c) + " AS VARCHAR)";
  }

  /** {@code LIKE} / {@code ILIKE}; the right-hand side is already a quoted literal or a parameter. */
  protected String renderPattern(String col, Operator op, String rhs) {
    if (op == Operator.ILIKE) return "LOWER(" + col + ") LIKE LOWER(" + rhs + ")";
    return col + " LIKE " + rhs;
  }

  protected String renderSortExpr(OrderByItem o, QueryState state) {
    AggregateFunction fn = state.aggregationOf(o.column());
    return fn.isAggregate() && !state.groupBy().contains(o.column())
        ? aggregate(fn, o.column())
        : column(o.column());
  }

  protected String renderLimit(int limit) {
    return "LIMIT " + limit;
  }

  protected String literal(String value, ColumnId column, RenderCtx ctx) {
    String v = value.strip();
    if (isParameter(v)) return v;
    if (NUMERIC.matcher(v).matches() && !ctx.types().isTextual(column)) return v;
    return quote(value);
  }

  protected String aggregate(AggregateFunction fn, ColumnId c) {
    return fn.name() + "(" + column(c) + ")";
  }

  protected String table(TableId t) {
    return quoteIdent(t.schema()) + "." + quoteIdent(t.name());
  }

  protected String column(ColumnId c) {
    return table(c.table()) + "." + quoteIdent(c.column());
  }

  protected static boolean isParameter(String v) {
    return v.length() > 1 && v.charAt(0) == ':';
  }

  protected static String quote(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  protected abstract String quoteIdent(String ident);
}

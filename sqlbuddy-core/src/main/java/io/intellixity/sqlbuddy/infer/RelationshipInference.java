package io.intellixity.sqlbuddy.infer;

import io.intellixity.sqlbuddy.schema.ColumnDef;
import io.intellixity.sqlbuddy.schema.DatabaseSchema;
import io.intellixity.sqlbuddy.schema.ForeignKeyRef;
import io.intellixity.sqlbuddy.schema.TableDef;
import io.intellixity.sqlbuddy.schema.TableId;
import io.intellixity.sqlbuddy.state.ExplicitJoin;
import io.intellixity.sqlbuddy.state.JoinType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Proposes at most one join between two tables.\n
 *
 * Rules, first match wins:\n
 * 1. a foreign key on A pointing at B (LEFT, A -> B)\n
 * 2. a foreign key on B pointing at A (LEFT, B -> A)\n
 * 3. same table name in two schemas sharing a key column of identical name and type (INNER)\n
 *
 * Pure and deterministic: the join id is derived from the join's content, so equal inputs give equal joins.
 * Absence of a match is a normal outcome and never an error.
 */
public final class RelationshipInference {
  private static final Logger log = LoggerFactory.getLogger(RelationshipInference.class);

  private RelationshipInference() {}

  public static Optional<ExplicitJoin> inferJoin(DatabaseSchema schema, TableId a, TableId b) {
    Objects.requireNonNull(schema, "schema");
    if (a == null || b == null || a.equals(b)) return Optional.empty();
    TableDef ta = schema.table(a).orElse(null);
    TableDef tb = schema.table(b).orElse(null);
    if (ta == null || tb == null) return Optional.empty();

    ExplicitJoin forward = foreignKeyJoin(ta, b);
    if (forward != null) return Optional.of(forward);

    ExplicitJoin backward = foreignKeyJoin(tb, a);
    if (backward != null) return Optional.of(backward);

    if (a.name().equals(b.name()) && !a.schema().equals(b.schema())) {
      ColumnDef shared = sharedKeyColumn(ta, tb);
      if (shared != null) return Optional.of(join(a, shared.name(), JoinType.INNER, b, shared.name()));
    }
    return Optional.empty();
  }

  /**
   * Join to offer when {@code newTable} is added next to {@code selectedTables}.\n
   *
   * Walks the current selection in insertion order; for each table tries (existing, new) then (new, existing).
   */
  public static Optional<ExplicitJoin> suggestJoin(DatabaseSchema schema, List<TableId> selectedTables, TableId newTable) {
    if (selectedTables == null || newTable == null) return Optional.empty();
    for (TableId existing : selectedTables) {
      if (existing.equals(newTable)) continue;
      Optional<ExplicitJoin> j = inferJoin(schema, existing, newTable);
      if (j.isEmpty()) j = inferJoin(schema, newTable, existing);
      if (j.isPresent()) {
        log.debug("sqlbuddy.infer suggestion newTable={} existing={} join={}", newTable, existing, j.get());
        return j;
      }
    }
    return Optional.empty();
  }

  private static ExplicitJoin foreignKeyJoin(TableDef owner, TableId target) {
    for (ColumnDef c : owner.columns()) {
      ForeignKeyRef ref = c.foreignKeyRef();
      if (ref == null || !ref.pointsTo(target)) continue;
      return join(owner.id(), c.name(), JoinType.LEFT, target, ref.column());
    }
    return null;
  }

  // Key column: named "id" or flagged primary key on either side, same name and type on both sides.
  private static ColumnDef sharedKeyColumn(TableDef a, TableDef b) {
    for (ColumnDef ca : a.columns()) {
      ColumnDef cb = b.column(ca.name()).orElse(null);
      if (cb == null || !ca.type().equals(cb.type())) continue;
      if (ca.name().equalsIgnoreCase("id") || ca.primaryKey() || cb.primaryKey()) return ca;
    }
    return null;
  }

  private static ExplicitJoin join(TableId from, String fromColumn, JoinType type, TableId to, String toColumn) {
    String key = type + ":" + from + "." + fromColumn + "->" + to + "." + toColumn;
    String id = UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    return new ExplicitJoin(id, from, fromColumn, type, to, toColumn);
  }
}

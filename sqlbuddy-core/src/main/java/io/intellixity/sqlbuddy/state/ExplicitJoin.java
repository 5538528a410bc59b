package io.intellixity.sqlbuddy.state;

import io.intellixity.sqlbuddy.schema.TableId;

import java.util.Objects;

/**
 * {@code <type> JOIN toTable ON fromTable.fromColumn = toTable.toColumn}.
 * <p>
 * Column names may be blank while a join is still being authored; the compiler rejects those.
 */
public record ExplicitJoin(String id, TableId fromTable, String fromColumn, JoinType type,
                           TableId toTable, String toColumn) {
  public ExplicitJoin {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(fromTable, "fromTable");
    Objects.requireNonNull(toTable, "toTable");
    fromColumn = (fromColumn == null) ? "" : fromColumn;
    toColumn = (toColumn == null) ? "" : toColumn;
    type = (type == null) ? JoinType.INNER : type;
  }

  public boolean mentions(TableId t) { return fromTable.equals(t) || toTable.equals(t); }

  public ExplicitJoin withType(JoinType type) {
    return new ExplicitJoin(id, fromTable, fromColumn, type, toTable, toColumn);
  }
}

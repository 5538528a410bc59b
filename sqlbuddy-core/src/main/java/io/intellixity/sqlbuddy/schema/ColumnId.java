package io.intellixity.sqlbuddy.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/** Fully-qualified column id: {@code "<schema>.<table>.<column>"}. */
public record ColumnId(TableId table, String column) {
  public ColumnId {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(column, "column");
    column = column.trim();
    if (column.isEmpty()) throw new IllegalArgumentException("column name is blank for table " + table);
  }

  public static ColumnId of(TableId table, String column) { return new ColumnId(table, column); }

  public static ColumnId of(String schema, String table, String column) {
    return new ColumnId(TableId.of(schema, table), column);
  }

  /**
   * Parses {@code "schema.table.column"}; a two-part {@code "table.column"} resolves to the default schema.
   */
  @JsonCreator
  public static ColumnId parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("column id is blank");
    String[] parts = s.trim().split("\\.", -1);
    return switch (parts.length) {
      case 3 -> of(parts[0], parts[1], parts[2]);
      case 2 -> of(null, parts[0], parts[1]);
      default -> throw new IllegalArgumentException("Malformed column id: " + s);
    };
  }

  public boolean belongsTo(TableId t) { return table.equals(t); }

  @JsonValue
  @Override
  public String toString() { return table + "." + column; }
}

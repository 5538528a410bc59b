package io.intellixity.sqlbuddy.schema;

/**
 * Parsed form of {@link ColumnDef#references()}.
 * <p>
 * Either {@code schema.table.column} (schema non-null) or legacy {@code table.column} (schema null).
 */
public record ForeignKeyRef(String schema, String table, String column) {

  /** Returns null when the reference text is absent or not in a supported form. */
  public static ForeignKeyRef parseOrNull(String references) {
    if (references == null || references.isBlank()) return null;
    String[] parts = references.trim().split("\\.", -1);
    for (String p : parts) if (p.isBlank()) return null;
    if (parts.length == 3) return new ForeignKeyRef(parts[0], parts[1], parts[2]);
    if (parts.length == 2) return new ForeignKeyRef(null, parts[0], parts[1]);
    return null;
  }

  public boolean isLegacy() { return schema == null; }

  /** 3-part refs match schema and table exactly; legacy refs match on table name alone. */
  public boolean pointsTo(TableId target) {
    if (target == null) return false;
    if (isLegacy()) return table.equals(target.name());
    return schema.equals(target.schema()) && table.equals(target.name());
  }
}

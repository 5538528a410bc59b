package io.intellixity.sqlbuddy.compile;

import io.intellixity.sqlbuddy.schema.ColumnDef;
import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.DatabaseSchema;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classifies a column's declared (free-form) type for literal rendering.
 * <p>
 * Used by dialect renderers to decide whether a numeric-looking filter value must still be quoted.
 */
public final class ColumnTypeResolver {
  public enum TypeClass { TEXTUAL, NUMERIC, TEMPORAL, BOOLEAN, OTHER, UNKNOWN }

  private final DatabaseSchema schema;
  private final Map<ColumnId, TypeClass> cache = new ConcurrentHashMap<>();

  public ColumnTypeResolver(DatabaseSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /** Declared type, or null if the column is not in the schema. */
  public String declaredType(ColumnId column) {
    return schema.column(column).map(ColumnDef::type).orElse(null);
  }

  public TypeClass classify(ColumnId column) {
    return cache.computeIfAbsent(column, c -> classifyType(declaredType(c)));
  }

  public boolean isTextual(ColumnId column) { return classify(column) == TypeClass.TEXTUAL; }

  static TypeClass classifyType(String declared) {
    if (declared == null) return TypeClass.UNKNOWN;
    String t = declared.trim().toLowerCase(Locale.ROOT);
    if (t.isEmpty()) return TypeClass.UNKNOWN;
    int paren = t.indexOf('(');
    if (paren > 0) t = t.substring(0, paren).trim();

    if (t.contains("char") || t.equals("text") || t.equals("string") || t.equals("uuid")
        || t.equals("citext") || t.equals("clob") || t.equals("name")) {
      return TypeClass.TEXTUAL;
    }
    if (t.startsWith("timestamp") || t.equals("date") || t.startsWith("time") || t.equals("interval")) {
      return TypeClass.TEMPORAL;
    }
    if (t.matches("(tiny|small|medium|big)?int(eger)?[248]?") || t.matches("(small|big)?serial[248]?")
        || t.startsWith("decimal") || t.startsWith("numeric") || t.equals("real") || t.startsWith("double")
        || t.startsWith("float") || t.equals("money") || t.equals("number")) {
      return TypeClass.NUMERIC;
    }
    if (t.startsWith("bool")) return TypeClass.BOOLEAN;
    return TypeClass.OTHER;
  }
}

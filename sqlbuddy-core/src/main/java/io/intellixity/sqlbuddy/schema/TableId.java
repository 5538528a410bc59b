package io.intellixity.sqlbuddy.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Identifies a table by schema and name.
 * <p>
 * Canonical string form is {@code "<schema>.<table>"}; an absent or blank schema is {@value #DEFAULT_SCHEMA}.
 */
public record TableId(String schema, String name) {
  public static final String DEFAULT_SCHEMA = "public";

  public TableId {
    schema = (schema == null || schema.isBlank()) ? DEFAULT_SCHEMA : schema.trim();
    Objects.requireNonNull(name, "name");
    name = name.trim();
    if (name.isEmpty()) throw new IllegalArgumentException("table name is blank");
    if (schema.contains(".") || name.contains(".")) {
      throw new IllegalArgumentException("table identifier parts must not contain '.': " + schema + "." + name);
    }
  }

  public static TableId of(String schema, String name) { return new TableId(schema, name); }

  /** Parses {@code "schema.table"} or a bare {@code "table"} (schema defaults to public). */
  @JsonCreator
  public static TableId parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("table id is blank");
    String t = s.trim();
    int dot = t.indexOf('.');
    if (dot < 0) return new TableId(null, t);
    if (t.indexOf('.', dot + 1) >= 0) throw new IllegalArgumentException("Malformed table id: " + s);
    return new TableId(t.substring(0, dot), t.substring(dot + 1));
  }

  /** Column-id prefix for this table ({@code "schema.table."}). */
  public String columnPrefix() { return this + "."; }

  @JsonValue
  @Override
  public String toString() { return schema + "." + name; }
}

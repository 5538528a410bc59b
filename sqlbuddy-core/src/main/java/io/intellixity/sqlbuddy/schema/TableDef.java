package io.intellixity.sqlbuddy.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableDef(@JsonProperty("schema") String schema,
                       @JsonProperty("name") String name,
                       @JsonProperty("columns") List<ColumnDef> columns,
                       @JsonProperty("description") String description) {
  @JsonCreator
  public TableDef {
    schema = (schema == null || schema.isBlank()) ? TableId.DEFAULT_SCHEMA : schema;
    Objects.requireNonNull(name, "name");
    columns = List.copyOf(columns == null ? List.of() : columns);
    Set<String> seen = new HashSet<>();
    for (ColumnDef c : columns) {
      if (!seen.add(c.name())) {
        throw new IllegalArgumentException("Duplicate column '" + c.name() + "' in table " + schema + "." + name);
      }
    }
  }

  public TableDef(String schema, String name, List<ColumnDef> columns) {
    this(schema, name, columns, null);
  }

  @JsonIgnore
  public TableId id() { return TableId.of(schema, name); }

  public Optional<ColumnDef> column(String columnName) {
    if (columnName == null) return Optional.empty();
    for (ColumnDef c : columns) if (c.name().equals(columnName)) return Optional.of(c);
    return Optional.empty();
  }

  public boolean hasColumn(String columnName) { return column(columnName).isPresent(); }
}

package io.intellixity.sqlbuddy.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Immutable description of the tables a query may use.\n
 *
 * Supplied by an external connector or generator; read-only for the lifetime of a building session.
 */
public final class DatabaseSchema {
  private final String name;
  private final List<TableDef> tables;
  private final Map<TableId, TableDef> byId;

  @JsonCreator
  public DatabaseSchema(@JsonProperty("name") String name, @JsonProperty("tables") List<TableDef> tables) {
    this.name = (name == null) ? "" : name;
    this.tables = List.copyOf(tables == null ? List.of() : tables);
    Map<TableId, TableDef> m = new LinkedHashMap<>();
    for (TableDef t : this.tables) {
      if (m.put(t.id(), t) != null) throw new IllegalArgumentException("Duplicate table id: " + t.id());
    }
    this.byId = Collections.unmodifiableMap(m);
  }

  @JsonProperty("name")
  public String name() { return name; }

  @JsonProperty("tables")
  public List<TableDef> tables() { return tables; }

  public Optional<TableDef> table(TableId id) { return Optional.ofNullable(byId.get(id)); }

  public boolean hasTable(TableId id) { return byId.containsKey(id); }

  public Optional<ColumnDef> column(ColumnId id) {
    TableDef t = byId.get(id.table());
    return t == null ? Optional.empty() : t.column(id.column());
  }

  public Set<TableId> tableIds() { return byId.keySet(); }
}

package io.intellixity.sqlbuddy.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ColumnDef(@JsonProperty("name") String name,
                        @JsonProperty("type") String type,
                        @JsonProperty("isPrimaryKey") boolean primaryKey,
                        @JsonProperty("isForeignKey") boolean foreignKey,
                        @JsonProperty("references") String references) {
  @JsonCreator
  public ColumnDef {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("column name is blank");
    type = (type == null) ? "" : type;
  }

  public static ColumnDef of(String name, String type) {
    return new ColumnDef(name, type, false, false, null);
  }

  public static ColumnDef primaryKey(String name, String type) {
    return new ColumnDef(name, type, true, false, null);
  }

  public static ColumnDef foreignKey(String name, String type, String references) {
    return new ColumnDef(name, type, false, true, references);
  }

  /** Parsed FK target, or null when this is not a foreign key with a usable reference. */
  public ForeignKeyRef foreignKeyRef() {
    return foreignKey ? ForeignKeyRef.parseOrNull(references) : null;
  }
}

package io.intellixity.sqlbuddy.spi.sql;

import java.util.List;
import java.util.Objects;

/** Compiled SQL text plus non-fatal diagnostics (unjoined tables). */
public record CompiledSql(String sql, List<String> warnings) {
  public CompiledSql {
    Objects.requireNonNull(sql, "sql");
    warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
  }

  public CompiledSql(String sql) {
    this(sql, List.of());
  }

  public boolean hasWarnings() { return !warnings.isEmpty(); }
}

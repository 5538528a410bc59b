package io.intellixity.sqlbuddy.spi.sql;

import io.intellixity.sqlbuddy.schema.DatabaseSchema;
import io.intellixity.sqlbuddy.spi.compile.CompileMode;
import io.intellixity.sqlbuddy.spi.compile.CompilerOptions;
import io.intellixity.sqlbuddy.state.QueryState;

/**
 * Backend-specific SQL rendering of a validated query state.\n
 *
 * Implementations are discovered through {@code META-INF/sqlbuddy.factories}; {@link #id()} is the lookup key.
 */
public interface Dialect {
  String id();

  /**
   * Renders the state. Callers run a {@link io.intellixity.sqlbuddy.spi.compile.StateValidationStrategy} first;
   * the dialect may still raise {@link io.intellixity.sqlbuddy.compile.ConsistencyException} for problems only
   * visible while planning (a join with no clause to attach to).
   */
  CompiledSql render(DatabaseSchema schema, QueryState state, CompileMode mode, CompilerOptions options);
}

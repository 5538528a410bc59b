package io.intellixity.sqlbuddy.spi.compile;

import io.intellixity.sqlbuddy.schema.DatabaseSchema;
import io.intellixity.sqlbuddy.state.QueryState;

/**
 * SPI hook to validate a query state before dialect rendering.
 * <p>
 * Throws {@link io.intellixity.sqlbuddy.compile.EmptySelectionException},
 * {@link io.intellixity.sqlbuddy.compile.StructuralException} or
 * {@link io.intellixity.sqlbuddy.compile.ConsistencyException}, in that order of precedence.
 * Applications may plug in stricter rules.
 */
public interface StateValidationStrategy {
  void validate(DatabaseSchema schema, QueryState state, CompileMode mode);
}

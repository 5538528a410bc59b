package io.intellixity.sqlbuddy.compile;

/** A reference points at a table that is not selected, or at a table/column the schema does not have. */
public final class StructuralException extends CompilationException {
  public StructuralException(String message) {
    super(message);
  }
}

package io.intellixity.sqlbuddy.formula;

/** Raised when a calculated-column formula is rejected at authoring time. */
public final class ExpressionValidationException extends RuntimeException {
  public ExpressionValidationException(String message) {
    super(message);
  }
}

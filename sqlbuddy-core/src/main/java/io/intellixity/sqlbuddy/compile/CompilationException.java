package io.intellixity.sqlbuddy.compile;

/**
 * Base of the errors the SQL compiler reports.
 * <p>
 * Live preview converts these into placeholder text; explicit generation propagates them.
 */
public abstract class CompilationException extends RuntimeException {
  protected CompilationException(String message) {
    super(message);
  }
}

package io.intellixity.sqlbuddy.compile;

/** Well-formed references that break a query rule (grouping, unattachable join, invalid limit). */
public final class ConsistencyException extends CompilationException {
  public ConsistencyException(String message) {
    super(message);
  }
}

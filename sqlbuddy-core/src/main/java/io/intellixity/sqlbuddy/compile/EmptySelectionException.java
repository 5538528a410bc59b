package io.intellixity.sqlbuddy.compile;

public final class EmptySelectionException extends CompilationException {
  public EmptySelectionException() {
    super("No table selected");
  }
}

package io.intellixity.sqlbuddy.spi.compile;

/**
 * PREVIEW never fails the caller and tolerates a non-positive limit; GENERATE is strict.
 */
public enum CompileMode {
  PREVIEW,
  GENERATE
}

package io.intellixity.sqlbuddy.spi.compile;

import io.intellixity.sqlbuddy.state.QueryState;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Compiler settings.\n
 *
 * {@link #load()} reads {@value #RESOURCE} from the classpath; absent keys keep their defaults.
 */
public record CompilerOptions(int defaultLimit, boolean multiline, boolean terminateStatement, String dialect) {
  public static final String RESOURCE = "sqlbuddy.properties";

  public static final String KEY_DEFAULT_LIMIT = "sqlbuddy.compiler.default-limit";
  public static final String KEY_MULTILINE = "sqlbuddy.compiler.multiline";
  public static final String KEY_TERMINATE = "sqlbuddy.compiler.terminate-statement";
  public static final String KEY_DIALECT = "sqlbuddy.compiler.dialect";

  public static final String DEFAULT_DIALECT = "ansi";

  public CompilerOptions {
    if (defaultLimit <= 0) throw new IllegalArgumentException("defaultLimit must be positive: " + defaultLimit);
    dialect = (dialect == null || dialect.isBlank()) ? DEFAULT_DIALECT : dialect.trim().toLowerCase(Locale.ROOT);
  }

  public static CompilerOptions defaults() {
    return new CompilerOptions(QueryState.DEFAULT_LIMIT, false, false, DEFAULT_DIALECT);
  }

  public static CompilerOptions load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static CompilerOptions load(ClassLoader cl) {
    if (cl == null) cl = CompilerOptions.class.getClassLoader();
    Properties p = new Properties();
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in != null) p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + RESOURCE, e);
    }
    return fromProperties(p);
  }

  public static CompilerOptions fromProperties(Properties p) {
    Objects.requireNonNull(p, "properties");
    CompilerOptions d = defaults();
    return new CompilerOptions(
        intProp(p, KEY_DEFAULT_LIMIT, d.defaultLimit()),
        boolProp(p, KEY_MULTILINE, d.multiline()),
        boolProp(p, KEY_TERMINATE, d.terminateStatement()),
        p.getProperty(KEY_DIALECT, d.dialect())
    );
  }

  public CompilerOptions withDialect(String dialect) {
    return new CompilerOptions(defaultLimit, multiline, terminateStatement, dialect);
  }

  public CompilerOptions withMultiline(boolean multiline) {
    return new CompilerOptions(defaultLimit, multiline, terminateStatement, dialect);
  }

  public CompilerOptions withTerminateStatement(boolean terminateStatement) {
    return new CompilerOptions(defaultLimit, multiline, terminateStatement, dialect);
  }

  private static int intProp(Properties p, String key, int dflt) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return dflt;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": '" + v + "'", e);
    }
  }

  private static boolean boolProp(Properties p, String key, boolean dflt) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return dflt;
    String s = v.trim().toLowerCase(Locale.ROOT);
    if (s.equals("true")) return true;
    if (s.equals("false")) return false;
    throw new IllegalArgumentException("Invalid boolean for " + key + ": '" + v + "'");
  }
}

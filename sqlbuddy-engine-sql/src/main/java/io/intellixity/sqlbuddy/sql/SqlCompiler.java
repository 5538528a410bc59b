package io.intellixity.sqlbuddy.sql;

import io.intellixity.sqlbuddy.compile.CompilationException;
import io.intellixity.sqlbuddy.compile.EmptySelectionException;
import io.intellixity.sqlbuddy.compile.StateNormalizer;
import io.intellixity.sqlbuddy.schema.DatabaseSchema;
import io.intellixity.sqlbuddy.spi.compile.CompileMode;
import io.intellixity.sqlbuddy.spi.compile.CompilerOptions;
import io.intellixity.sqlbuddy.spi.compile.DefaultStateValidationStrategy;
import io.intellixity.sqlbuddy.spi.compile.StateValidationStrategy;
import io.intellixity.sqlbuddy.spi.sql.CompiledSql;
import io.intellixity.sqlbuddy.spi.sql.Dialect;
import io.intellixity.sqlbuddy.sql.dialect.Dialects;
import io.intellixity.sqlbuddy.state.QueryState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point: validates a query state and renders it through the configured dialect.\n
 *
 * {@link #generate} is strict and propagates every {@link CompilationException}.\n
 * {@link #preview} never throws: failures become a SQL comment the preview panel can display.\n
 */
public final class SqlCompiler {
  private static final Logger log = LoggerFactory.getLogger(SqlCompiler.class);

  public static final String EMPTY_SELECTION_COMMENT = "-- Select tables to begin";
  public static final String INCOMPLETE_PREFIX = "-- Complete the selection to see the SQL: ";
  public static final String FAILURE_PREFIX = "-- Unable to render SQL: ";
  public static final String WARNING_PREFIX = "-- warning: ";

  private final CompilerOptions options;
  private final Dialect dialect;
  private final StateValidationStrategy validation;

  public SqlCompiler() {
    this(CompilerOptions.load());
  }

  public SqlCompiler(CompilerOptions options) {
    this(options, new Dialects().get(options.dialect()), new DefaultStateValidationStrategy());
  }

  public SqlCompiler(CompilerOptions options, Dialect dialect, StateValidationStrategy validation) {
    this.options = Objects.requireNonNull(options, "options");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.validation = Objects.requireNonNull(validation, "validation");
  }

  public CompilerOptions options() { return options; }
  public Dialect dialect() { return dialect; }

  /** Blank state carrying the configured default limit. */
  public QueryState newState() {
    return QueryState.empty(options.defaultLimit());
  }

  public StateNormalizer normalizer(DatabaseSchema schema) {
    return new StateNormalizer(schema, options.defaultLimit());
  }

  public CompiledSql compile(DatabaseSchema schema, QueryState state, CompileMode mode) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(mode, "mode");
    long t0 = System.nanoTime();

    validation.validate(schema, state, mode);
    CompiledSql out = dialect.render(schema, state, mode, options);

    if (log.isDebugEnabled()) {
      log.debug("sqlbuddy.compile mode={} dialect={} tables={} joins={} filters={} warnings={} durationMs={}",
          mode, dialect.id(), state.selectedTables().size(), state.joins().size(), state.filters().size(),
          out.warnings().size(), (System.nanoTime() - t0) / 1_000_000.0);
      for (String w : out.warnings()) log.debug("sqlbuddy.compile warning={}", w);
    }
    return out;
  }

  /** Strict compilation for an explicit generate/run action. */
  public CompiledSql generate(DatabaseSchema schema, QueryState state) {
    return compile(schema, state, CompileMode.GENERATE);
  }

  /**
   * Live-preview text: the SQL preceded by one {@value #WARNING_PREFIX} line per warning, or a single
   * comment line explaining why no SQL can be shown yet.
   */
  public String preview(DatabaseSchema schema, QueryState state) {
    try {
      CompiledSql c = compile(schema, state, CompileMode.PREVIEW);
      if (!c.hasWarnings()) return c.sql();
      StringBuilder sb = new StringBuilder();
      for (String w : c.warnings()) sb.append(WARNING_PREFIX).append(w).append('\n');
      return sb.append(c.sql()).toString();
    } catch (EmptySelectionException e) {
      return EMPTY_SELECTION_COMMENT;
    } catch (CompilationException e) {
      log.debug("sqlbuddy.preview incomplete reason={}", e.getMessage());
      return INCOMPLETE_PREFIX + e.getMessage();
    } catch (RuntimeException e) {
      log.warn("sqlbuddy.preview failed dialect={} error={}", dialect.id(), e.toString(), e);
      return FAILURE_PREFIX + e.getMessage();
    }
  }
}

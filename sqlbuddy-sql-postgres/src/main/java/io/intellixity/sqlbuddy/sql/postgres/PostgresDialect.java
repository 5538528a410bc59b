package io.intellixity.sqlbuddy.sql.postgres;

import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.sql.dialect.AbstractSqlDialect;
import io.intellixity.sqlbuddy.state.Operator;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Postgres dialect.
 *
 * Keeps only Postgres-specific overrides.\n
 * Generic SQL rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  public static final String ID = "postgres";

  // Unquoted identifiers fold to lower case, so anything else must be quoted to survive.
  private static final Pattern PLAIN = Pattern.compile("[a-z_][a-z0-9_$]*");

  private static final Set<String> RESERVED = Set.of(
      "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "both", "case", "cast", "check",
      "column", "constraint", "create", "default", "desc", "distinct", "do", "else", "end", "except",
      "false", "fetch", "for", "foreign", "from", "grant", "group", "having", "in", "into", "is", "join",
      "leading", "like", "ilike", "limit", "not", "null", "offset", "on", "only", "or", "order",
      "primary", "references", "select", "table", "then", "to", "trailing", "true", "union", "unique",
      "user", "using", "when", "where", "window", "with"
  );

  @Override public String id() { return ID; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    if (PLAIN.matcher(ident).matches() && !RESERVED.contains(ident)) return ident;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String patternOperand(ColumnId c, RenderCtx ctx) {
    return column(c) + "::text";
  }

  @Override
  protected String renderPattern(String col, Operator op, String rhs) {
    return col + " " + op.sql() + " " + rhs;
  }
}

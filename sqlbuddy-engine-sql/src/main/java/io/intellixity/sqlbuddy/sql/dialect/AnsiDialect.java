package io.intellixity.sqlbuddy.sql.dialect;

import java.util.regex.Pattern;

/**
 * Portable SQL.\n
 *
 * Identifiers are double-quoted only when they are not plain {@code [A-Za-z_][A-Za-z0-9_]*} words;
 * ILIKE is emulated with {@code LOWER(..) LIKE LOWER(..)}.
 */
public class AnsiDialect extends AbstractSqlDialect {
  public static final String ID = "ansi";

  private static final Pattern PLAIN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  @Override public String id() { return ID; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    if (PLAIN.matcher(ident).matches()) return ident;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}

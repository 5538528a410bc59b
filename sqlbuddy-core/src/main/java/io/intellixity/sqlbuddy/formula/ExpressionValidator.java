package io.intellixity.sqlbuddy.formula;

import java.util.Locale;

/**
 * Shallow structural check for calculated-column formulas.\n
 *
 * Not a SQL parser: balanced but otherwise invalid expressions are left for the database to reject.
 */
public final class ExpressionValidator {
  private ExpressionValidator() {}

  /** Checks, in order: alias non-blank, expression non-blank, parentheses balanced. */
  public static void validate(String alias, String expression) {
    if (alias == null || alias.isBlank()) {
      throw new ExpressionValidationException("Calculated column needs a name (alias)");
    }
    if (expression == null || expression.isBlank()) {
      throw new ExpressionValidationException("Formula for '" + alias.trim() + "' is empty");
    }
    int open = 0;
    int close = 0;
    for (int i = 0; i < expression.length(); i++) {
      char c = expression.charAt(i);
      if (c == '(') open++;
      else if (c == ')') close++;
    }
    if (open != close) {
      throw new ExpressionValidationException(
          "Unbalanced parentheses in '" + alias.trim() + "': opened=" + open + ", closed=" + close);
    }
  }

  /** Lower-cases and replaces whitespace runs with {@code _}. */
  public static String sanitizeAlias(String alias) {
    if (alias == null) return "";
    return alias.trim().replaceAll("\\s+", "_").toLowerCase(Locale.ROOT);
  }
}

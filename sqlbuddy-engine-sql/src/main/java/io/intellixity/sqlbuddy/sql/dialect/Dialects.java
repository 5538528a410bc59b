package io.intellixity.sqlbuddy.sql.dialect;

import io.intellixity.sqlbuddy.spi.sql.Dialect;
import io.intellixity.sqlbuddy.util.SqlBuddyFactoriesLoader;

import java.util.*;

/**
 * Dialect registry built via discovery (META-INF/sqlbuddy.factories).\n
 *
 * Resolution semantics:\n
 * - ids are case-insensitive\n
 * - the first provider registered for an id wins\n
 * - {@link AnsiDialect} is always available\n
 */
public final class Dialects {
  private final Map<String, Dialect> byId;

  public Dialects() {
    this(SqlBuddyFactoriesLoader.load(Dialect.class));
  }

  Dialects(List<Dialect> discovered) {
    Map<String, Dialect> m = new LinkedHashMap<>();
    m.put(AnsiDialect.ID, new AnsiDialect());
    for (Dialect d : discovered) {
      if (d == null || d.id() == null) continue;
      m.putIfAbsent(normalize(d.id()), d);
    }
    this.byId = Collections.unmodifiableMap(m);
  }

  public Dialect get(String id) {
    Dialect d = byId.get(normalize(id));
    if (d == null) {
      throw new IllegalArgumentException("Unknown dialect '" + id + "', available: " + byId.keySet());
    }
    return d;
  }

  public Set<String> ids() { return byId.keySet(); }

  private static String normalize(String id) {
    return (id == null) ? "" : id.trim().toLowerCase(Locale.ROOT);
  }
}

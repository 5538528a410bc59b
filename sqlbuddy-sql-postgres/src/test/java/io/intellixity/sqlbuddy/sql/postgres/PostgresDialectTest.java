package io.intellixity.sqlbuddy.sql.postgres;

import io.intellixity.sqlbuddy.schema.ColumnDef;
import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.DatabaseSchema;
import io.intellixity.sqlbuddy.schema.TableDef;
import io.intellixity.sqlbuddy.schema.TableId;
import io.intellixity.sqlbuddy.spi.compile.CompilerOptions;
import io.intellixity.sqlbuddy.sql.SqlCompiler;
import io.intellixity.sqlbuddy.sql.dialect.Dialects;
import io.intellixity.sqlbuddy.state.AggregateFunction;
import io.intellixity.sqlbuddy.state.JoinType;
import io.intellixity.sqlbuddy.state.Operator;
import io.intellixity.sqlbuddy.state.QueryState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.sqlbuddy.state.QueryStateMutations.*;
import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private static final TableId USERS = TableId.of("public", "user");
  private static final TableId EVENTS = TableId.of("Analytics", "events");

  private static final DatabaseSchema SCHEMA = new DatabaseSchema("pg", List.of(
      new TableDef("public", "user", List.of(
          ColumnDef.primaryKey("id", "uuid"),
          ColumnDef.of("createdAt", "timestamptz"),
          ColumnDef.of("age", "int4"))),
      new TableDef("Analytics", "events", List.of(
          ColumnDef.primaryKey("id", "bigint"),
          ColumnDef.foreignKey("user_id", "uuid", "public.user.id")))
  ));

  private final SqlCompiler compiler = new SqlCompiler(CompilerOptions.defaults().withDialect("postgres"));

  @Test
  void isDiscoveredThroughFactories() {
    assertTrue(new Dialects().get("postgres") instanceof PostgresDialect);
    assertEquals("postgres", compiler.dialect().id());
  }

  @Test
  void quotesMixedCaseAndReservedIdentifiers() {
    PostgresDialect d = new PostgresDialect();
    assertEquals("orders", d.quoteIdent("orders"));
    assertEquals("\"user\"", d.quoteIdent("user"));
    assertEquals("\"createdAt\"", d.quoteIdent("createdAt"));
    assertEquals("\"Analytics\"", d.quoteIdent("Analytics"));
  }

  @Test
  void patternsRunOnTextCast() {
    QueryState s = addTable(QueryState.empty(), USERS);
    s = addFilter(s, ColumnId.of(USERS, "age"), Operator.LIKE, "4%");
    s = addFilter(s, ColumnId.of(USERS, "id"), Operator.ILIKE, "abc%");
    assertEquals(
        "SELECT public.\"user\".* FROM public.\"user\" WHERE public.\"user\".age::text LIKE '4%' "
            + "AND public.\"user\".id::text ILIKE 'abc%' LIMIT 100",
        compiler.generate(SCHEMA, s).sql());
  }

  @Test
  void joinsAcrossQuotedSchemas() {
    QueryState s = addTable(addTable(QueryState.empty(), EVENTS), USERS);
    s = addJoin(s, EVENTS, "user_id", JoinType.LEFT, USERS, "id");
    s = setAggregation(s, ColumnId.of(EVENTS, "id"), AggregateFunction.COUNT);
    s = selectColumn(s, ColumnId.of(USERS, "createdAt"));
    s = toggleGroupBy(s, ColumnId.of(USERS, "createdAt"));

    assertEquals(
        "SELECT COUNT(\"Analytics\".events.id) AS id_count, public.\"user\".\"createdAt\" FROM \"Analytics\".events "
            + "LEFT JOIN public.\"user\" ON \"Analytics\".events.user_id = public.\"user\".id "
            + "GROUP BY public.\"user\".\"createdAt\" LIMIT 100",
        compiler.generate(SCHEMA, s).sql());
  }
}

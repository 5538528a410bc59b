package io.intellixity.sqlbuddy.compile;

import io.intellixity.sqlbuddy.ShopSchema;
import io.intellixity.sqlbuddy.schema.ColumnDef;
import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.DatabaseSchema;
import io.intellixity.sqlbuddy.schema.TableDef;
import io.intellixity.sqlbuddy.schema.TableId;
import io.intellixity.sqlbuddy.state.AggregateFunction;
import io.intellixity.sqlbuddy.state.CalculatedColumn;
import io.intellixity.sqlbuddy.state.QueryState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.intellixity.sqlbuddy.ShopSchema.*;
import static org.junit.jupiter.api.Assertions.*;

final class SelectionPlanTest {
  private final DatabaseSchema schema = ShopSchema.load();

  @Test
  void tableWithoutColumnsIsWildcard() {
    SelectionPlan p = SelectionPlan.of(schema, QueryState.empty().withSelectedTables(List.of(ORDERS, CUSTOMERS)));
    assertEquals(2, p.items().size());
    assertTrue(p.items().get(0).isWildcard());
    assertEquals(ORDERS, p.items().get(0).table());
    assertFalse(p.isGrouping());
    assertEquals(7, p.plainColumns(schema).size());
  }

  @Test
  void aggregatedTableWithoutSelectionExpandsSchemaColumns() {
    ColumnId amount = ColumnId.of(ORDERS, "amount");
    QueryState s = QueryState.empty()
        .withSelectedTables(List.of(ORDERS))
        .withAggregations(Map.of(amount, AggregateFunction.SUM));
    SelectionPlan p = SelectionPlan.of(schema, s);

    assertTrue(p.isGrouping());
    assertEquals(4, p.items().size());
    SelectItem agg = p.items().get(2);
    assertTrue(agg.isAggregated());
    assertEquals("amount_sum", agg.alias());
    assertEquals(List.of(ColumnId.of(ORDERS, "id"), ColumnId.of(ORDERS, "customer_id"), ColumnId.of(ORDERS, "status")),
        p.plainColumns(schema));
  }

  @Test
  void explicitColumnsThenUnlistedAggregates() {
    ColumnId status = ColumnId.of(ORDERS, "status");
    ColumnId amount = ColumnId.of(ORDERS, "amount");
    QueryState s = QueryState.empty()
        .withSelectedTables(List.of(ORDERS))
        .withSelectedColumns(List.of(status))
        .withAggregations(Map.of(amount, AggregateFunction.MAX));
    SelectionPlan p = SelectionPlan.of(schema, s);

    assertEquals(2, p.items().size());
    assertEquals(status, p.items().get(0).column());
    assertEquals(AggregateFunction.MAX, p.items().get(1).function());
    assertEquals(List.of(status), p.plainColumns(schema));
  }

  @Test
  void aliasCollisionsAreTableQualified() {
    ColumnId a = ColumnId.of(CUSTOMERS, "id");
    ColumnId b = ColumnId.of(SALES_CUSTOMERS, "id");
    ColumnId c = ColumnId.of(ORDERS, "id");
    QueryState s = QueryState.empty()
        .withSelectedTables(List.of(CUSTOMERS, SALES_CUSTOMERS, ORDERS))
        .withSelectedColumns(List.of(a, b, c))
        .withAggregations(Map.of(a, AggregateFunction.COUNT, b, AggregateFunction.COUNT, c, AggregateFunction.COUNT));
    List<SelectItem> items = SelectionPlan.of(schema, s).items();

    assertEquals("id_count", items.get(0).alias());
    assertEquals("customers_id_count", items.get(1).alias());
    assertEquals("orders_id_count", items.get(2).alias());
  }

  @Test
  void qualifiedCollisionFallsBackToNumberSuffix() {
    List<TableId> tables = List.of(TableId.of("eu", "t"), TableId.of("us", "t"), TableId.of("ap", "t"));
    List<TableDef> defs = new ArrayList<>();
    List<ColumnId> cols = new ArrayList<>();
    Map<ColumnId, AggregateFunction> aggs = new LinkedHashMap<>();
    for (TableId t : tables) {
      defs.add(new TableDef(t.schema(), t.name(), List.of(ColumnDef.of("v", "int"))));
      ColumnId c = ColumnId.of(t, "v");
      cols.add(c);
      aggs.put(c, AggregateFunction.AVG);
    }
    DatabaseSchema db = new DatabaseSchema("regions", defs);
    QueryState s = QueryState.empty().withSelectedTables(tables).withSelectedColumns(cols).withAggregations(aggs);

    List<SelectItem> items = SelectionPlan.of(db, s).items();
    assertEquals(List.of("v_avg", "t_v_avg", "t_v_avg_2"), items.stream().map(SelectItem::alias).toList());
  }

  @Test
  void aggregateAliasAvoidsCalculatedColumnAliases() {
    ColumnId amount = ColumnId.of(ORDERS, "amount");
    QueryState s = QueryState.empty()
        .withSelectedTables(List.of(ORDERS))
        .withSelectedColumns(List.of(amount))
        .withAggregations(Map.of(amount, AggregateFunction.SUM))
        .withCalculatedColumns(List.of(new CalculatedColumn("c1", "amount_sum", "1")));

    List<SelectItem> items = SelectionPlan.of(schema, s).items();
    assertEquals(1, items.size());
    assertEquals("orders_amount_sum", items.get(0).alias());
  }
}

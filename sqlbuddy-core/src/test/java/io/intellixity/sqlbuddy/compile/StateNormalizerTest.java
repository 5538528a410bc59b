package io.intellixity.sqlbuddy.compile;

import io.intellixity.sqlbuddy.ShopSchema;
import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.TableId;
import io.intellixity.sqlbuddy.state.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.sqlbuddy.ShopSchema.*;
import static org.junit.jupiter.api.Assertions.*;

final class StateNormalizerTest {
  private final StateNormalizer normalizer = new StateNormalizer(ShopSchema.load(), 200);

  @Test
  void dropsUnknownTablesAndWhatHangsOffThem() {
    TableId ghost = TableId.parse("public.ghost");
    QueryState candidate = QueryState.empty(0)
        .withSelectedTables(List.of(ORDERS, ghost))
        .withSelectedColumns(List.of(ColumnId.of(ORDERS, "status"), ColumnId.of(ghost, "x"), ColumnId.of(ORDERS, "nope")))
        .withAggregations(Map.of(ColumnId.of(ORDERS, "amount"), AggregateFunction.SUM))
        .withJoins(List.of(new ExplicitJoin("j1", ORDERS, "id", JoinType.INNER, ghost, "order_id")))
        .withFilters(List.of(new Filter("f1", ColumnId.of(ghost, "x"), Operator.EQ, "1")))
        .withGroupBy(List.of(ColumnId.of(ORDERS, "status")))
        .withOrderBy(List.of(new OrderByItem("o1", ColumnId.of(CUSTOMERS, "name"), OrderByItem.Direction.ASC)));

    QueryState s = normalizer.normalize(candidate);

    assertEquals(List.of(ORDERS), s.selectedTables());
    assertEquals(List.of(ColumnId.of(ORDERS, "status"), ColumnId.of(ORDERS, "amount")), s.selectedColumns());
    assertEquals(AggregateFunction.SUM, s.aggregationOf(ColumnId.of(ORDERS, "amount")));
    assertTrue(s.joins().isEmpty());
    assertTrue(s.filters().isEmpty());
    assertEquals(List.of(ColumnId.of(ORDERS, "status")), s.groupBy());
    assertTrue(s.orderBy().isEmpty());
    assertEquals(200, s.limit());
  }

  @Test
  void keepsValidJoinsAndDropsBadFormulas() {
    QueryState candidate = QueryState.empty(25)
        .withSelectedTables(List.of(ORDERS, CUSTOMERS))
        .withJoins(List.of(
            new ExplicitJoin("ok", ORDERS, "customer_id", JoinType.LEFT, CUSTOMERS, "id"),
            new ExplicitJoin("blank", ORDERS, "", JoinType.LEFT, CUSTOMERS, "id")))
        .withCalculatedColumns(List.of(
            new CalculatedColumn("c1", "Double Amount", "public.orders.amount * 2"),
            new CalculatedColumn("c2", "bad", "(1 + 2")));

    QueryState s = normalizer.normalize(candidate);

    assertEquals(1, s.joins().size());
    assertEquals("ok", s.joins().get(0).id());
    assertEquals(1, s.calculatedColumns().size());
    assertEquals("double_amount", s.calculatedColumns().get(0).alias());
    assertEquals(25, s.limit());
  }

  @Test
  void formulasOnDroppedTablesGoWithThem() {
    TableId ghost = TableId.parse("public.ghost");
    QueryState candidate = QueryState.empty()
        .withSelectedTables(List.of(ORDERS, ghost))
        .withCalculatedColumns(List.of(
            new CalculatedColumn("c1", "ghostly", "public.ghost.x + 1"),
            new CalculatedColumn("c2", "doubled", "public.orders.amount * 2")));

    QueryState s = normalizer.normalize(candidate);

    assertEquals(List.of("doubled"), s.calculatedColumns().stream().map(CalculatedColumn::alias).toList());
    assertEquals(s, QueryStateMutations.removeTable(
        QueryStateMutations.addTable(s, ghost).withCalculatedColumns(candidate.calculatedColumns()), ghost));
  }

  @Test
  void nullCandidateIsEmpty() {
    assertEquals(QueryState.empty(200), normalizer.normalize(null));
  }

  @Test
  void normalizedStateIsStable() {
    QueryState candidate = QueryState.empty()
        .withSelectedTables(List.of(CUSTOMERS))
        .withSelectedColumns(List.of(ColumnId.of(CUSTOMERS, "region")))
        .withFilters(List.of(new Filter("f", ColumnId.of(CUSTOMERS, "region"), Operator.EQ, "EU")));
    QueryState once = normalizer.normalize(candidate);
    assertEquals(once, normalizer.normalize(once));
  }
}

package io.intellixity.sqlbuddy.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.sqlbuddy.ShopSchema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DatabaseSchemaTest {
  @Test
  void readsConnectorJson() {
    DatabaseSchema s = ShopSchema.load();
    assertEquals("shop", s.name());
    assertEquals(5, s.tables().size());

    TableDef orders = s.table(ShopSchema.ORDERS).orElseThrow();
    ColumnDef fk = orders.column("customer_id").orElseThrow();
    assertTrue(fk.foreignKey());
    assertEquals("public.customers.id", fk.references());
    assertTrue(orders.column("id").orElseThrow().primaryKey());

    // missing schema falls back to public
    assertTrue(s.hasTable(TableId.parse("order_items")));
    assertEquals("Registered customers", s.table(ShopSchema.CUSTOMERS).orElseThrow().description());
  }

  @Test
  void sameNameInTwoSchemasAreDistinctTables() {
    DatabaseSchema s = ShopSchema.load();
    assertNotEquals(ShopSchema.CUSTOMERS, ShopSchema.SALES_CUSTOMERS);
    assertEquals(3, s.table(ShopSchema.CUSTOMERS).orElseThrow().columns().size());
    assertEquals(2, s.table(ShopSchema.SALES_CUSTOMERS).orElseThrow().columns().size());
  }

  @Test
  void columnLookupGoesThroughTable() {
    DatabaseSchema s = ShopSchema.load();
    assertTrue(s.column(ColumnId.parse("public.orders.amount")).isPresent());
    assertTrue(s.column(ColumnId.parse("orders.amount")).isPresent());
    assertTrue(s.column(ColumnId.parse("sales.customers.region")).isEmpty());
    assertTrue(s.column(ColumnId.parse("public.nope.x")).isEmpty());
  }

  @Test
  void rejectsDuplicateTablesAndColumns() {
    TableDef t = new TableDef("public", "t", List.of(ColumnDef.of("a", "int")));
    assertThrows(IllegalArgumentException.class, () -> new DatabaseSchema("db", List.of(t, t)));
    assertThrows(IllegalArgumentException.class,
        () -> new TableDef("public", "t", List.of(ColumnDef.of("a", "int"), ColumnDef.of("a", "text"))));
  }

  @Test
  void parsesIdentifiers() {
    assertEquals(TableId.of("public", "orders"), TableId.parse("orders"));
    assertEquals(TableId.of("sales", "customers"), TableId.parse("sales.customers"));
    assertThrows(IllegalArgumentException.class, () -> TableId.parse("a.b.c"));

    ColumnId c = ColumnId.parse("sales.customers.name");
    assertEquals(ShopSchema.SALES_CUSTOMERS, c.table());
    assertEquals("name", c.column());
    assertEquals("sales.customers.name", c.toString());
    assertThrows(IllegalArgumentException.class, () -> ColumnId.parse("name"));
  }

  @Test
  void foreignKeyReferenceForms() {
    ForeignKeyRef full = ForeignKeyRef.parseOrNull("public.customers.id");
    assertNotNull(full);
    assertTrue(full.pointsTo(ShopSchema.CUSTOMERS));
    assertFalse(full.pointsTo(ShopSchema.SALES_CUSTOMERS));

    ForeignKeyRef legacy = ForeignKeyRef.parseOrNull("customers.id");
    assertNotNull(legacy);
    assertTrue(legacy.isLegacy());
    assertTrue(legacy.pointsTo(ShopSchema.CUSTOMERS));
    assertTrue(legacy.pointsTo(ShopSchema.SALES_CUSTOMERS));

    assertNull(ForeignKeyRef.parseOrNull("id"));
    assertNull(ForeignKeyRef.parseOrNull("a..b"));
    assertNull(ColumnDef.foreignKey("x", "int", "garbage").foreignKeyRef());
  }

  @Test
  void writesSchemaBackAsJson() throws Exception {
    ObjectMapper json = new ObjectMapper();
    DatabaseSchema s = ShopSchema.load();
    DatabaseSchema back = json.readValue(json.writeValueAsString(s), DatabaseSchema.class);
    assertEquals(s.tableIds(), back.tableIds());
    assertEquals(s.table(ShopSchema.ORDERS), back.table(ShopSchema.ORDERS));
  }
}

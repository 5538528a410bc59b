package io.intellixity.sqlbuddy.state;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.TableId;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link QueryState}.\n
 *
 * Lenient about absent fields (older documents have no {@code calculatedColumns}); entries without an
 * {@code id} get a fresh one. Malformed identifiers fail with {@link IllegalArgumentException}.
 */
public final class QueryStateJsonDeserializer extends JsonDeserializer<QueryState> {
  @Override
  public QueryState deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("QueryState JSON must be an object");

    JsonNode limitNode = root.get("limit");
    int limit = (limitNode == null || limitNode.isNull())
        ? QueryState.DEFAULT_LIMIT
        : (limitNode.isNumber() ? limitNode.intValue() : Integer.parseInt(limitNode.asText().trim()));

    List<TableId> tables = new ArrayList<>();
    for (String s : texts(root.get("selectedTables"))) tables.add(TableId.parse(s));

    Map<ColumnId, AggregateFunction> aggs = new LinkedHashMap<>();
    JsonNode a = root.get("aggregations");
    if (a != null && a.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = a.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        AggregateFunction fn = AggregateFunction.parse(textOrNull(e.getValue()));
        if (fn.isAggregate()) aggs.put(ColumnId.parse(e.getKey()), fn);
      }
    }

    List<CalculatedColumn> calcs = new ArrayList<>();
    for (JsonNode c : objects(root.get("calculatedColumns"))) {
      calcs.add(new CalculatedColumn(idOf(c), textOrEmpty(c.get("alias")), textOrEmpty(c.get("expression"))));
    }

    List<ExplicitJoin> joins = new ArrayList<>();
    for (JsonNode j : objects(root.get("joins"))) {
      String type = textOrNull(j.get("type"));
      joins.add(new ExplicitJoin(
          idOf(j),
          TableId.parse(textOrEmpty(j.get("fromTable"))),
          textOrEmpty(j.get("fromColumn")),
          type == null ? JoinType.INNER : JoinType.valueOf(type.trim().toUpperCase()),
          TableId.parse(textOrEmpty(j.get("toTable"))),
          textOrEmpty(j.get("toColumn"))));
    }

    List<Filter> filters = new ArrayList<>();
    for (JsonNode f : objects(root.get("filters"))) {
      String op = textOrNull(f.get("operator"));
      filters.add(new Filter(
          idOf(f),
          ColumnId.parse(textOrEmpty(f.get("column"))),
          op == null ? Operator.EQ : Operator.fromSql(op),
          textOrEmpty(f.get("value"))));
    }

    List<OrderByItem> orderBy = new ArrayList<>();
    for (JsonNode o : objects(root.get("orderBy"))) {
      String dir = textOrNull(o.get("direction"));
      orderBy.add(new OrderByItem(
          idOf(o),
          ColumnId.parse(textOrEmpty(o.get("column"))),
          dir == null ? OrderByItem.Direction.ASC : OrderByItem.Direction.valueOf(dir.trim().toUpperCase())));
    }

    return QueryState.empty(limit)
        .withSelectedTables(tables)
        .withSelectedColumns(columnIds(root.get("selectedColumns")))
        .withAggregations(aggs)
        .withCalculatedColumns(calcs)
        .withJoins(joins)
        .withFilters(filters)
        .withGroupBy(columnIds(root.get("groupBy")))
        .withOrderBy(orderBy);
  }

  private static List<ColumnId> columnIds(JsonNode arr) {
    List<ColumnId> out = new ArrayList<>();
    for (String s : texts(arr)) out.add(ColumnId.parse(s));
    return out;
  }

  private static List<String> texts(JsonNode arr) {
    if (arr == null || !arr.isArray()) return List.of();
    List<String> out = new ArrayList<>();
    for (JsonNode x : arr) if (x.isTextual() && !x.asText().isBlank()) out.add(x.asText());
    return out;
  }

  private static List<JsonNode> objects(JsonNode arr) {
    if (arr == null || !arr.isArray()) return List.of();
    List<JsonNode> out = new ArrayList<>();
    for (JsonNode x : arr) if (x.isObject()) out.add(x);
    return out;
  }

  private static String idOf(JsonNode n) {
    String id = textOrNull(n.get("id"));
    return (id == null || id.isBlank()) ? UUID.randomUUID().toString() : id;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static String textOrEmpty(JsonNode n) {
    String s = textOrNull(n);
    return s == null ? "" : s;
  }
}

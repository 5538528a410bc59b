package io.intellixity.sqlbuddy.state;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.sqlbuddy.schema.ColumnId;
import io.intellixity.sqlbuddy.schema.TableId;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/** Canonical JSON serializer for {@link QueryState}; the persisted builder document shape. */
public final class QueryStateJsonSerializer extends JsonSerializer<QueryState> {
  @Override
  public void serialize(QueryState s, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (s == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    g.writeArrayFieldStart("selectedTables");
    for (TableId t : s.selectedTables()) g.writeString(t.toString());
    g.writeEndArray();

    writeColumnIds("selectedColumns", s.selectedColumns(), g);

    g.writeArrayFieldStart("calculatedColumns");
    for (CalculatedColumn c : s.calculatedColumns()) {
      g.writeStartObject();
      g.writeStringField("id", c.id());
      g.writeStringField("alias", c.alias());
      g.writeStringField("expression", c.expression());
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeObjectFieldStart("aggregations");
    for (Map.Entry<ColumnId, AggregateFunction> e : s.aggregations().entrySet()) {
      g.writeStringField(e.getKey().toString(), e.getValue().name());
    }
    g.writeEndObject();

    g.writeArrayFieldStart("joins");
    for (ExplicitJoin j : s.joins()) {
      g.writeStartObject();
      g.writeStringField("id", j.id());
      g.writeStringField("fromTable", j.fromTable().toString());
      g.writeStringField("fromColumn", j.fromColumn());
      g.writeStringField("toTable", j.toTable().toString());
      g.writeStringField("toColumn", j.toColumn());
      g.writeStringField("type", j.type().name());
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeArrayFieldStart("filters");
    for (Filter f : s.filters()) {
      g.writeStartObject();
      g.writeStringField("id", f.id());
      g.writeStringField("column", f.column().toString());
      g.writeStringField("operator", f.operator().sql());
      g.writeStringField("value", f.value());
      g.writeEndObject();
    }
    g.writeEndArray();

    writeColumnIds("groupBy", s.groupBy(), g);

    g.writeArrayFieldStart("orderBy");
    for (OrderByItem o : s.orderBy()) {
      g.writeStartObject();
      g.writeStringField("id", o.id());
      g.writeStringField("column", o.column().toString());
      g.writeStringField("direction", o.direction().name());
      g.writeEndObject();
    }
    g.writeEndArray();

    g.writeNumberField("limit", s.limit());

    g.writeEndObject();
  }

  private static void writeColumnIds(String field, List<ColumnId> ids, JsonGenerator g) throws IOException {
    g.writeArrayFieldStart(field);
    for (ColumnId c : ids) g.writeString(c.toString());
    g.writeEndArray();
  }
}

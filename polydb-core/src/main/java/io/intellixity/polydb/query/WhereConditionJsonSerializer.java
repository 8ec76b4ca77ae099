package io.intellixity.polydb.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link WhereCondition}. */
public final class WhereConditionJsonSerializer extends JsonSerializer<WhereCondition> {
  @Override
  public void serialize(WhereCondition value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
    write(value, gen);
  }

  private static void write(WhereCondition value, JsonGenerator gen) throws IOException {
    if (value == null) {
      gen.writeNull();
      return;
    }
    gen.writeStartObject();
    if (value instanceof AtomicCondition a) {
      gen.writeStringField("type", "Atomic");
      gen.writeObjectFieldStart("atomic");
      gen.writeStringField("key", a.key());
      gen.writeStringField("operator", a.operator().symbol());
      if (a.value() != null) gen.writeStringField("value", a.value());
      if (a.columnType() != null) gen.writeStringField("columnType", a.columnType());
      gen.writeEndObject();
    } else if (value instanceof LogicalGroup g) {
      String field = g.clause() == Clause.OR ? "or" : "and";
      gen.writeStringField("type", g.clause().label());
      gen.writeObjectFieldStart(field);
      gen.writeArrayFieldStart("children");
      for (WhereCondition c : g.children()) write(c, gen);
      gen.writeEndArray();
      gen.writeEndObject();
    } else {
      throw new IllegalArgumentException("Unsupported WhereCondition: " + value.getClass().getName());
    }
    gen.writeEndObject();
  }
}

package io.intellixity.polydb.elasticsearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.query.AtomicCondition;
import io.intellixity.polydb.query.Clause;
import io.intellixity.polydb.query.LogicalGroup;
import io.intellixity.polydb.query.Operator;
import io.intellixity.polydb.query.WhereCondition;
import io.intellixity.polydb.query.WhereConditionVisitor;
import io.intellixity.polydb.spi.coerce.ColumnKind;
import io.intellixity.polydb.spi.coerce.ValueCoercion;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Renders {@link WhereCondition} filters to the Elasticsearch query DSL.
 *
 * <p>Groups become {@code bool} queries ({@code filter} for AND, {@code should} for OR). Equality without
 * a {@code columnType} is a {@code match} with operator {@code and}, so it works for analyzed text as
 * well as keyword and numeric fields; with a non-text {@code columnType} it is an exact {@code term}.
 * {@code LIKE} maps to {@code wildcard} and negations wrap the positive form in {@code must_not}.
 * {@code _id} only takes equality, {@code IN} and null checks.</p>
 */
final class ElasticQueryRenderer {
  static final String ID = "_id";
  private static final Set<Operator> ID_OPERATORS = EnumSet.of(
      Operator.EQ, Operator.NE, Operator.IN, Operator.NOT_IN, Operator.IS_NULL, Operator.IS_NOT_NULL);

  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private ElasticQueryRenderer() {}

  static ObjectNode toQuery(WhereCondition where) {
    if (where == null) return matchAll();
    ObjectNode q = where.accept(new WhereConditionVisitor<ObjectNode>() {
      @Override
      public ObjectNode visit(AtomicCondition c) {
        return atomic(c);
      }

      @Override
      public ObjectNode visit(LogicalGroup g) {
        List<ObjectNode> parts = new ArrayList<>();
        for (WhereCondition child : g.children()) {
          ObjectNode part = child.accept(this);
          if (part != null) parts.add(part);
        }
        if (parts.isEmpty()) return null;
        if (parts.size() == 1) return parts.get(0);
        ObjectNode bool = NODES.objectNode();
        ArrayNode clauses = bool.putArray(g.clause() == Clause.OR ? "should" : "filter");
        parts.forEach(clauses::add);
        if (g.clause() == Clause.OR) bool.put("minimum_should_match", 1);
        return wrap("bool", bool);
      }
    });
    return q == null ? matchAll() : q;
  }

  private static ObjectNode atomic(AtomicCondition c) {
    String field = c.key();
    if (ID.equals(field) && !ID_OPERATORS.contains(c.operator())) {
      throw EngineException.malformedFilter(ID, "_id does not support " + c.operator().symbol());
    }
    switch (c.operator()) {
      case IS_NULL:
        return mustNot(exists(field));
      case IS_NOT_NULL:
        return exists(field);
      case EQ:
        return equality(c, c.value());
      case NE:
        return mustNot(equality(c, c.value()));
      case GT:
        return range(field, "gt", value(c, c.value()));
      case GE:
        return range(field, "gte", value(c, c.value()));
      case LT:
        return range(field, "lt", value(c, c.value()));
      case LE:
        return range(field, "lte", value(c, c.value()));
      case IN:
        return terms(c);
      case NOT_IN:
        return mustNot(terms(c));
      case LIKE:
        return wildcard(field, c.value());
      case NOT_LIKE:
      default:
        return mustNot(wildcard(field, c.value()));
    }
  }

  private static ObjectNode equality(AtomicCondition c, String raw) {
    if (ID.equals(c.key())) {
      ObjectNode ids = NODES.objectNode();
      ids.putArray("values").add(raw);
      return wrap("ids", ids);
    }
    if (typed(c)) return wrap("term", field(c.key(), value(c, raw)));
    ObjectNode match = NODES.objectNode();
    match.put("query", raw);
    match.put("operator", "and");
    return wrap("match", field(c.key(), match));
  }

  private static ObjectNode terms(AtomicCondition c) {
    ArrayNode values = NODES.arrayNode();
    for (String v : c.values()) values.add(value(c, v));
    if (ID.equals(c.key())) {
      ObjectNode ids = NODES.objectNode();
      ids.set("values", values);
      return wrap("ids", ids);
    }
    return wrap("terms", field(c.key(), values));
  }

  private static ObjectNode range(String field, String op, JsonNode value) {
    ObjectNode bound = NODES.objectNode();
    bound.set(op, value);
    return wrap("range", field(field, bound));
  }

  private static ObjectNode exists(String field) {
    ObjectNode e = NODES.objectNode();
    e.put("field", field);
    return wrap("exists", e);
  }

  private static ObjectNode wildcard(String field, String like) {
    ObjectNode w = NODES.objectNode();
    w.put("value", toWildcard(like));
    return wrap("wildcard", field(field, w));
  }

  private static ObjectNode mustNot(ObjectNode query) {
    ObjectNode bool = NODES.objectNode();
    bool.putArray("must_not").add(query);
    return wrap("bool", bool);
  }

  static ObjectNode matchAll() {
    return wrap("match_all", NODES.objectNode());
  }

  /** SQL LIKE to wildcard syntax: {@code %} to {@code *}, {@code _} to {@code ?}, literal metacharacters escaped. */
  static String toWildcard(String like) {
    StringBuilder sb = new StringBuilder(like.length());
    for (char ch : like.toCharArray()) {
      switch (ch) {
        case '%': sb.append('*'); break;
        case '_': sb.append('?'); break;
        case '*':
        case '?':
        case '\\':
          sb.append('\\').append(ch);
          break;
        default:
          sb.append(ch);
      }
    }
    return sb.toString();
  }

  private static boolean typed(AtomicCondition c) {
    return c.columnType() != null && !c.columnType().isBlank() && ColumnKind.classify(c.columnType()) != ColumnKind.TEXT;
  }

  /** Typed JSON value: numbers and booleans as JSON scalars, everything else as the given string. */
  static JsonNode value(AtomicCondition c, String raw) {
    if (c.columnType() == null || c.columnType().isBlank()) return NODES.textNode(raw);
    ColumnKind kind = ColumnKind.classify(c.columnType());
    if (kind == ColumnKind.TEXT) return NODES.textNode(raw);
    Object v = ValueCoercion.coerce(kind, raw, c.key(), ValueCoercion.Mode.FILTER);
    if (v instanceof Long l) return NODES.numberNode(l);
    if (v instanceof BigInteger b) return NODES.numberNode(b);
    if (v instanceof BigDecimal d) return NODES.numberNode(d);
    if (v instanceof Double d) return NODES.numberNode(d);
    if (v instanceof Boolean b) return NODES.booleanNode(b);
    return NODES.textNode(raw.trim());
  }

  private static ObjectNode field(String name, JsonNode value) {
    ObjectNode o = NODES.objectNode();
    o.set(name, value);
    return o;
  }

  private static ObjectNode wrap(String name, JsonNode body) {
    return field(name, body);
  }
}

package io.intellixity.polydb.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.polydb.error.EngineException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Canonical JSON deserializer for {@link WhereCondition}.
 *
 * <pre>
 * {"type":"Atomic","atomic":{"key":"name","operator":"=","value":"Bob","columnType":"text"}}
 * {"type":"And","and":{"children":[ ... ]}}
 * {"type":"Or","or":{"children":[ ... ]}}
 * </pre>
 */
public final class WhereConditionJsonDeserializer extends JsonDeserializer<WhereCondition> {
  @Override
  public WhereCondition deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    return parse(root);
  }

  static WhereCondition parse(JsonNode node) {
    if (!node.isObject()) throw EngineException.malformedFilter(node.toString(), "condition must be a JSON object");
    String type = textOrNull(node.get("type"));
    if (type == null) {
      // Infer from the populated branch.
      if (node.has("atomic")) type = "atomic";
      else if (node.has("and")) type = "and";
      else if (node.has("or")) type = "or";
      else throw EngineException.malformedFilter(node.toString(), "condition has no type");
    }
    return switch (type.toLowerCase(Locale.ROOT)) {
      case "atomic" -> parseAtomic(node.get("atomic"));
      case "and" -> new LogicalGroup(Clause.AND, parseChildren(node.get("and")));
      case "or" -> new LogicalGroup(Clause.OR, parseChildren(node.get("or")));
      default -> throw EngineException.malformedFilter(type, "unknown condition type");
    };
  }

  private static AtomicCondition parseAtomic(JsonNode a) {
    if (a == null || !a.isObject()) throw EngineException.malformedFilter("atomic", "atomic body is missing");
    return new AtomicCondition(
        textOrNull(a.get("columnType")),
        textOrNull(a.get("key")),
        Operator.fromSymbol(textOrNull(a.get("operator"))),
        textOrNull(a.get("value")));
  }

  private static List<WhereCondition> parseChildren(JsonNode group) {
    JsonNode children = group == null ? null : group.get("children");
    if (children == null || !children.isArray()) {
      throw EngineException.malformedFilter(String.valueOf(group), "group children must be an array");
    }
    List<WhereCondition> out = new ArrayList<>();
    for (JsonNode c : children) out.add(parse(c));
    return out;
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    return n.asText();
  }
}

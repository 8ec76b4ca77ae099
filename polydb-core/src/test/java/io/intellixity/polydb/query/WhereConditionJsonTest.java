package io.intellixity.polydb.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.error.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class WhereConditionJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesNestedGroups() throws Exception {
    String s = """
        {
          "type": "Or",
          "or": {
            "children": [
              { "type": "Atomic", "atomic": { "key": "name", "operator": "=", "value": "Bob", "columnType": "text" } },
              { "type": "And", "and": { "children": [
                { "type": "Atomic", "atomic": { "key": "id", "operator": ">", "value": "1" } },
                { "type": "Atomic", "atomic": { "key": "id", "operator": "IN", "value": "2, 3" } }
              ] } }
            ]
          }
        }
        """;
    WhereCondition w = JSON.readValue(s, WhereCondition.class);
    assertTrue(w instanceof LogicalGroup);
    LogicalGroup or = (LogicalGroup) w;
    assertEquals(Clause.OR, or.clause());
    assertEquals(2, or.children().size());

    AtomicCondition name = (AtomicCondition) or.children().get(0);
    assertEquals("name", name.key());
    assertEquals(Operator.EQ, name.operator());
    assertEquals("Bob", name.value());
    assertEquals("text", name.columnType());

    LogicalGroup and = (LogicalGroup) or.children().get(1);
    AtomicCondition in = (AtomicCondition) and.children().get(1);
    assertEquals(Operator.IN, in.operator());
    assertEquals(java.util.List.of("2", "3"), in.values());
  }

  @Test
  void writesCanonicalShapeThatReadsBack() throws Exception {
    WhereCondition w = WhereConditions.and(
        WhereConditions.eq("name", "Alice"),
        WhereConditions.isNull("deleted_at"));
    String json = JSON.writeValueAsString(w);
    assertTrue(json.contains("\"type\":\"And\""));
    assertTrue(json.contains("\"operator\":\"IS NULL\""));
    assertEquals(w, JSON.readValue(json, WhereCondition.class));
  }

  @Test
  void typeIsInferredFromPopulatedBranch() throws Exception {
    WhereCondition w = WhereConditionJsonDeserializer.parse(JSON.readTree("""
        { "atomic": { "key": "id", "operator": "eq", "value": "7" } }
        """));
    assertEquals(WhereConditions.eq("id", "7"), w);
  }

  @Test
  void emptyGroupIsRejected() throws Exception {
    EngineException ex = assertThrows(EngineException.class, () -> WhereConditionJsonDeserializer.parse(JSON.readTree("""
        { "type": "And", "and": { "children": [] } }
        """)));
    assertEquals(ErrorKind.MALFORMED_FILTER, ex.kind());
  }

  @Test
  void unknownOperatorIsMalformedFilter() throws Exception {
    EngineException ex = assertThrows(EngineException.class, () -> WhereConditionJsonDeserializer.parse(JSON.readTree("""
        { "type": "Atomic", "atomic": { "key": "id", "operator": "~~", "value": "7" } }
        """)));
    assertEquals(ErrorKind.MALFORMED_FILTER, ex.kind());
    assertEquals("~~", ex.subject());
  }
}

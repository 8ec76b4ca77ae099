package io.intellixity.polydb.elasticsearch;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ConsoleRequestTest {

  @Test
  void parsesMethodPathParametersAndBody() {
    ConsoleRequest r = ConsoleRequest.parse("get orders/_search?q=status%3Aopen&pretty\n{\n  \"size\": 2\n}\n");

    assertEquals("GET", r.method());
    assertEquals("/orders/_search", r.path());
    assertEquals(Map.of("q", "status:open", "pretty", ""), r.parameters());
    assertEquals("{\n  \"size\": 2\n}", r.body());
  }

  @Test
  void bodyIsOptional() {
    ConsoleRequest r = ConsoleRequest.parse("DELETE /old-index");

    assertEquals("DELETE", r.method());
    assertNull(r.body());
    assertTrue(r.parameters().isEmpty());
  }

  @Test
  void rejectsUnknownMethodOrMissingPath() {
    assertEquals(ErrorKind.MALFORMED_INPUT, assertThrows(EngineException.class, () -> ConsoleRequest.parse("FETCH /x")).kind());
    assertEquals(ErrorKind.MALFORMED_INPUT, assertThrows(EngineException.class, () -> ConsoleRequest.parse("GET")).kind());
    assertEquals(ErrorKind.MALFORMED_INPUT, assertThrows(EngineException.class, () -> ConsoleRequest.parse("  ")).kind());
  }
}

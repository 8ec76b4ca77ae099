package io.intellixity.polydb.query;

import io.intellixity.polydb.error.EngineException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single {@code key operator value} predicate.
 *
 * <p>{@code columnType} is the caller's hint for the value type; relational adapters prefer the
 * introspected column type. List operators carry their values comma-separated.</p>
 */
public final class AtomicCondition implements WhereCondition {
  private final String columnType;
  private final String key;
  private final Operator operator;
  private final String value;

  public AtomicCondition(String columnType, String key, Operator operator, String value) {
    if (key == null || key.isBlank()) throw EngineException.malformedFilter(String.valueOf(key), "condition key is required");
    this.columnType = columnType;
    this.key = key;
    this.operator = Objects.requireNonNull(operator, "operator");
    if (operator.arity() != Operator.Arity.NONE && value == null) {
      throw EngineException.malformedFilter(key + " " + operator.symbol(), "operator requires a value");
    }
    this.value = value;
  }

  public String columnType() { return columnType; }
  public String key() { return key; }
  public Operator operator() { return operator; }
  public String value() { return value; }

  /** Values of a list operator, trimmed; a single-element list otherwise. */
  public List<String> values() {
    if (value == null) return List.of();
    if (operator.arity() != Operator.Arity.LIST) return List.of(value);
    List<String> out = new ArrayList<>();
    for (String part : value.split(",")) {
      String t = part.trim();
      if (!t.isEmpty()) out.add(t);
    }
    return out;
  }

  @Override
  public <R> R accept(WhereConditionVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof AtomicCondition c)) return false;
    return Objects.equals(columnType, c.columnType) && key.equals(c.key) && operator == c.operator && Objects.equals(value, c.value);
  }

  @Override
  public int hashCode() { return Objects.hash(columnType, key, operator, value); }

  @Override
  public String toString() {
    return operator.arity() == Operator.Arity.NONE ? key + " " + operator.symbol() : key + " " + operator.symbol() + " " + value;
  }
}

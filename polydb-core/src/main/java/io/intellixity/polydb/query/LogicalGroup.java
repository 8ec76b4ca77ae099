package io.intellixity.polydb.query;

import io.intellixity.polydb.error.EngineException;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class LogicalGroup implements WhereCondition {
  private final Clause clause;
  private final List<WhereCondition> children;

  public LogicalGroup(Clause clause, List<WhereCondition> children) {
    this.clause = Objects.requireNonNull(clause, "clause");
    if (children == null || children.isEmpty()) {
      throw EngineException.malformedFilter(clause.label(), "group must have at least one child");
    }
    for (WhereCondition c : children) Objects.requireNonNull(c, "child");
    this.children = List.copyOf(children);
  }

  public Clause clause() { return clause; }
  public List<WhereCondition> children() { return children; }

  @Override
  public <R> R accept(WhereConditionVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LogicalGroup g)) return false;
    return clause == g.clause && children.equals(g.children);
  }

  @Override
  public int hashCode() { return Objects.hash(clause, children); }

  @Override
  public String toString() {
    return children.stream().map(String::valueOf)
        .collect(Collectors.joining(" " + clause.name() + " ", "(", ")"));
  }
}

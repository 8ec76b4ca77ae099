package io.intellixity.polydb.query;

public interface WhereConditionVisitor<R> {
  R visit(AtomicCondition condition);
  R visit(LogicalGroup group);
}

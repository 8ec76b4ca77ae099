package io.intellixity.polydb.query;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class WhereConditions {
  private WhereConditions() {}

  public static AtomicCondition atomic(String key, String operator, String value, String columnType) {
    return new AtomicCondition(columnType, key, Operator.fromSymbol(operator), value);
  }

  public static AtomicCondition eq(String key, String value) { return new AtomicCondition(null, key, Operator.EQ, value); }
  public static AtomicCondition ne(String key, String value) { return new AtomicCondition(null, key, Operator.NE, value); }
  public static AtomicCondition gt(String key, String value) { return new AtomicCondition(null, key, Operator.GT, value); }
  public static AtomicCondition ge(String key, String value) { return new AtomicCondition(null, key, Operator.GE, value); }
  public static AtomicCondition lt(String key, String value) { return new AtomicCondition(null, key, Operator.LT, value); }
  public static AtomicCondition le(String key, String value) { return new AtomicCondition(null, key, Operator.LE, value); }
  public static AtomicCondition like(String key, String pattern) { return new AtomicCondition(null, key, Operator.LIKE, pattern); }
  public static AtomicCondition isNull(String key) { return new AtomicCondition(null, key, Operator.IS_NULL, null); }
  public static AtomicCondition isNotNull(String key) { return new AtomicCondition(null, key, Operator.IS_NOT_NULL, null); }

  public static AtomicCondition in(String key, Collection<String> values) {
    return new AtomicCondition(null, key, Operator.IN, String.join(",", values));
  }

  public static AtomicCondition notIn(String key, Collection<String> values) {
    return new AtomicCondition(null, key, Operator.NOT_IN, String.join(",", values));
  }

  public static LogicalGroup and(WhereCondition... children) {
    return new LogicalGroup(Clause.AND, List.of(children));
  }

  public static LogicalGroup or(WhereCondition... children) {
    return new LogicalGroup(Clause.OR, List.of(children));
  }

  /** Keys referenced anywhere in the tree, in first-seen order. */
  public static Set<String> keys(WhereCondition where) {
    Set<String> out = new LinkedHashSet<>();
    if (where == null) return out;
    where.accept(new WhereConditionVisitor<Void>() {
      @Override
      public Void visit(AtomicCondition condition) {
        out.add(condition.key());
        return null;
      }

      @Override
      public Void visit(LogicalGroup group) {
        for (WhereCondition c : group.children()) c.accept(this);
        return null;
      }
    });
    return out;
  }

  /** Operators used anywhere in the tree. */
  public static Set<Operator> operators(WhereCondition where) {
    Set<Operator> out = new LinkedHashSet<>();
    if (where == null) return out;
    where.accept(new WhereConditionVisitor<Void>() {
      @Override
      public Void visit(AtomicCondition condition) {
        out.add(condition.operator());
        return null;
      }

      @Override
      public Void visit(LogicalGroup group) {
        for (WhereCondition c : group.children()) c.accept(this);
        return null;
      }
    });
    return out;
  }
}

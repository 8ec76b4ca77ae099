package io.intellixity.polydb.spi.filter;

import io.intellixity.polydb.error.EngineException;
import io.intellixity.polydb.query.AtomicCondition;
import io.intellixity.polydb.query.Clause;
import io.intellixity.polydb.query.LogicalGroup;
import io.intellixity.polydb.query.Operator;
import io.intellixity.polydb.query.WhereCondition;
import io.intellixity.polydb.query.WhereConditionVisitor;
import io.intellixity.polydb.spi.coerce.ColumnKind;
import io.intellixity.polydb.spi.coerce.ValueCoercion;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Client-side evaluation of a {@link WhereCondition} over string rows.
 *
 * <p>Used by engines without a native predicate language. Comparison is typed: the column kind comes
 * from the condition's {@code columnType} when given, otherwise from the row schema. A {@code null}
 * cell only matches {@code IS NULL}. A cell that does not parse as its kind never matches.</p>
 */
public final class InMemoryFilter {
  private final Map<String, ColumnKind> kinds;

  private InMemoryFilter(Map<String, ColumnKind> kinds) {
    this.kinds = kinds;
  }

  /** Filter over rows whose columns are exactly the keys of {@code kinds}. */
  public static InMemoryFilter forColumns(Map<String, ColumnKind> kinds) {
    return new InMemoryFilter(Map.copyOf(Objects.requireNonNull(kinds, "kinds")));
  }

  public List<Map<String, String>> apply(List<Map<String, String>> rows, WhereCondition where) {
    if (where == null) return rows;
    validate(where);
    List<Map<String, String>> out = new ArrayList<>();
    for (Map<String, String> row : rows) {
      if (matches(where, row)) out.add(row);
    }
    return out;
  }

  /** Fails with {@code MALFORMED_FILTER} for unknown columns or values that do not fit their kind. */
  public void validate(WhereCondition where) {
    if (where == null) return;
    where.accept(new WhereConditionVisitor<Void>() {
      @Override
      public Void visit(AtomicCondition c) {
        ColumnKind kind = kindOf(c);
        if (isLike(c)) return null;
        for (String v : c.values()) ValueCoercion.coerce(kind, v, c.key(), ValueCoercion.Mode.FILTER);
        return null;
      }

      @Override
      public Void visit(LogicalGroup g) {
        for (WhereCondition child : g.children()) child.accept(this);
        return null;
      }
    });
  }

  public boolean matches(WhereCondition where, Map<String, String> row) {
    return where.accept(new WhereConditionVisitor<Boolean>() {
      @Override
      public Boolean visit(AtomicCondition c) {
        return test(c, row);
      }

      @Override
      public Boolean visit(LogicalGroup g) {
        boolean and = g.clause() == Clause.AND;
        for (WhereCondition child : g.children()) {
          boolean r = child.accept(this);
          if (and && !r) return false;
          if (!and && r) return true;
        }
        return and;
      }
    });
  }

  private boolean test(AtomicCondition c, Map<String, String> row) {
    ColumnKind kind = kindOf(c);
    String cell = row.get(c.key());
    switch (c.operator()) {
      case IS_NULL:
        return cell == null;
      case IS_NOT_NULL:
        return cell != null;
      default:
        break;
    }
    if (cell == null) return false;
    if (c.operator() == Operator.LIKE) return toRegex(c.value()).matcher(cell).matches();
    if (c.operator() == Operator.NOT_LIKE) return !toRegex(c.value()).matcher(cell).matches();

    Object actual;
    try {
      actual = ValueCoercion.coerce(kind, cell, c.key(), ValueCoercion.Mode.FILTER);
    } catch (EngineException e) {
      return false;
    }
    if (actual == null) return false;

    switch (c.operator()) {
      case IN:
        return anyEqual(kind, c, actual);
      case NOT_IN:
        return !anyEqual(kind, c, actual);
      default:
        break;
    }

    int cmp = ValueCoercion.compare(actual, ValueCoercion.coerce(kind, c.value(), c.key(), ValueCoercion.Mode.FILTER));
    switch (c.operator()) {
      case EQ: return cmp == 0;
      case NE: return cmp != 0;
      case GT: return cmp > 0;
      case GE: return cmp >= 0;
      case LT: return cmp < 0;
      case LE: return cmp <= 0;
      default:
        throw EngineException.malformedFilter(c.toString(), "unsupported operator " + c.operator().symbol());
    }
  }

  private boolean anyEqual(ColumnKind kind, AtomicCondition c, Object actual) {
    for (String v : c.values()) {
      if (ValueCoercion.compare(actual, ValueCoercion.coerce(kind, v, c.key(), ValueCoercion.Mode.FILTER)) == 0) return true;
    }
    return false;
  }

  private static boolean isLike(AtomicCondition c) {
    return c.operator() == Operator.LIKE || c.operator() == Operator.NOT_LIKE;
  }

  private ColumnKind kindOf(AtomicCondition c) {
    ColumnKind declared = kinds.get(c.key());
    if (declared == null) throw EngineException.malformedFilter(c.key(), "unknown column; expected one of " + kinds.keySet());
    if (c.columnType() != null && !c.columnType().isBlank()) return ColumnKind.classify(c.columnType());
    return declared;
  }

  /** SQL LIKE pattern to an anchored regex: {@code %} is any run, {@code _} one character. */
  public static Pattern toRegex(String like) {
    StringBuilder sb = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (char ch : like.toCharArray()) {
      if (ch == '%' || ch == '_') {
        if (literal.length() > 0) {
          sb.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        sb.append(ch == '%' ? ".*" : ".");
      } else {
        literal.append(ch);
      }
    }
    if (literal.length() > 0) sb.append(Pattern.quote(literal.toString()));
    return Pattern.compile(sb.toString(), Pattern.DOTALL);
  }
}

package io.intellixity.polydb.mongo;

import io.intellixity.polydb.query.AtomicCondition;
import io.intellixity.polydb.query.Clause;
import io.intellixity.polydb.query.LogicalGroup;
import io.intellixity.polydb.query.WhereCondition;
import io.intellixity.polydb.query.WhereConditionVisitor;
import io.intellixity.polydb.spi.coerce.ColumnKind;
import io.intellixity.polydb.spi.coerce.ValueCoercion;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Renders {@link WhereCondition} filters to MongoDB BSON ({@link Document}).
 *
 * Values arrive as strings. With a {@code columnType} they are coerced to that kind; without one an
 * equality matches both the literal string and the scalar it reads as ({@code "42"} and {@code 42}),
 * and range comparisons use the scalar. A 24-hex value on {@code _id} becomes an {@link ObjectId}.
 */
final class MongoQueryRenderer {
  static final String ID = "_id";

  private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");
  private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+([eE][-+]?\\d+)?");
  private static final Pattern OBJECT_ID = Pattern.compile("[0-9a-fA-F]{24}");

  private MongoQueryRenderer() {}

  static Document toBson(WhereCondition where) {
    if (where == null) return new Document();
    Document d = where.accept(new WhereConditionVisitor<Document>() {
      @Override
      public Document visit(AtomicCondition c) {
        return atomic(c);
      }

      @Override
      public Document visit(LogicalGroup g) {
        List<Document> parts = new ArrayList<>();
        for (WhereCondition child : g.children()) {
          Document part = child.accept(this);
          if (part != null && !part.isEmpty()) parts.add(part);
        }
        if (parts.isEmpty()) return new Document();
        if (parts.size() == 1) return parts.get(0);
        return new Document(g.clause() == Clause.OR ? "$or" : "$and", parts);
      }
    });
    return d == null ? new Document() : d;
  }

  private static Document atomic(AtomicCondition c) {
    String path = c.key();
    return switch (c.operator()) {
      case IS_NULL -> new Document(path, null);
      case IS_NOT_NULL -> new Document(path, new Document("$ne", null));
      case EQ -> {
        List<Object> cands = candidates(c, c.value());
        yield cands.size() == 1 ? new Document(path, cands.get(0)) : new Document(path, new Document("$in", cands));
      }
      case NE -> new Document(path, new Document("$nin", candidates(c, c.value())));
      case GT -> new Document(path, new Document("$gt", scalar(c, c.value())));
      case GE -> new Document(path, new Document("$gte", scalar(c, c.value())));
      case LT -> new Document(path, new Document("$lt", scalar(c, c.value())));
      case LE -> new Document(path, new Document("$lte", scalar(c, c.value())));
      case IN -> new Document(path, new Document("$in", listCandidates(c)));
      case NOT_IN -> new Document(path, new Document("$nin", listCandidates(c)));
      case LIKE -> likePositive(path, c.value());
      case NOT_LIKE -> new Document("$nor", List.of(likePositive(path, c.value())));
    };
  }

  private static List<Object> listCandidates(AtomicCondition c) {
    List<Object> out = new ArrayList<>();
    for (String v : c.values()) {
      for (Object cand : candidates(c, v)) {
        if (!out.contains(cand)) out.add(cand);
      }
    }
    return out;
  }

  /** Values an equality on {@code raw} should match. */
  static List<Object> candidates(AtomicCondition c, String raw) {
    if (raw == null) {
      List<Object> out = new ArrayList<>();
      out.add(null);
      return out;
    }
    if (c.columnType() != null && !c.columnType().isBlank()) return new ArrayList<>(List.of(scalar(c, raw)));
    List<Object> out = new ArrayList<>();
    Object typed = infer(c.key(), raw);
    if (typed instanceof ObjectId) out.add(typed);
    out.add(raw);
    if (!(typed instanceof ObjectId) && !raw.equals(typed)) out.add(typed);
    return out;
  }

  static Object scalar(AtomicCondition c, String raw) {
    if (c.columnType() != null && !c.columnType().isBlank()) {
      ColumnKind kind = ColumnKind.classify(c.columnType());
      return toBsonValue(ValueCoercion.coerce(kind, raw, c.key(), ValueCoercion.Mode.FILTER));
    }
    return infer(c.key(), raw);
  }

  /** Scalar a boundary string reads as: ObjectId for {@code _id}, then integer, decimal, boolean, else the string. */
  static Object infer(String key, String raw) {
    if (raw == null) return null;
    String s = raw.trim();
    if (ID.equals(key) && OBJECT_ID.matcher(s).matches()) return new ObjectId(s);
    if (INTEGER.matcher(s).matches()) return Long.parseLong(s);
    if (DECIMAL.matcher(s).matches()) return Double.parseDouble(s);
    if (s.equals("true") || s.equals("false")) return Boolean.parseBoolean(s);
    return raw;
  }

  /** Coerced values the default codec registry can encode. */
  static Object toBsonValue(Object v) {
    if (v instanceof BigInteger bi) return new Decimal128(new BigDecimal(bi));
    if (v instanceof BigDecimal bd) return new Decimal128(bd);
    if (v instanceof UUID u) return u.toString();
    if (v instanceof OffsetDateTime t) return Date.from(t.toInstant());
    return v;
  }

  private static Document likePositive(String path, String likePattern) {
    // SQL LIKE to anchored regex: '%' -> '.*', '_' -> '.'
    String p = likePattern == null ? "" : likePattern;
    StringBuilder re = new StringBuilder("^");
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < p.length(); i++) {
      char ch = p.charAt(i);
      if (ch == '%' || ch == '_') {
        if (literal.length() > 0) {
          re.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        re.append(ch == '%' ? ".*" : ".");
      } else {
        literal.append(ch);
      }
    }
    if (literal.length() > 0) re.append(Pattern.quote(literal.toString()));
    re.append("$");
    return new Document(path, new Document("$regex", re.toString()).append("$options", "s"));
  }
}

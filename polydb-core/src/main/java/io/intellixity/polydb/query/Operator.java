package io.intellixity.polydb.query;

import io.intellixity.polydb.error.EngineException;

import java.util.Locale;

public enum Operator {
  EQ("=", Arity.SINGLE),
  NE("!=", Arity.SINGLE),
  GT(">", Arity.SINGLE),
  GE(">=", Arity.SINGLE),
  LT("<", Arity.SINGLE),
  LE("<=", Arity.SINGLE),
  LIKE("LIKE", Arity.SINGLE),
  NOT_LIKE("NOT LIKE", Arity.SINGLE),
  IN("IN", Arity.LIST),
  NOT_IN("NOT IN", Arity.LIST),
  IS_NULL("IS NULL", Arity.NONE),
  IS_NOT_NULL("IS NOT NULL", Arity.NONE);

  /** How many values the operator consumes from the boundary string. */
  public enum Arity { NONE, SINGLE, LIST }

  private final String symbol;
  private final Arity arity;

  Operator(String symbol, Arity arity) {
    this.symbol = symbol;
    this.arity = arity;
  }

  public String symbol() { return symbol; }
  public Arity arity() { return arity; }

  /** Parses a canonical symbol ({@code >=}, {@code NOT IN}) or enum name; {@code <>} is accepted for NE. */
  public static Operator fromSymbol(String raw) {
    if (raw == null || raw.isBlank()) throw EngineException.malformedFilter(String.valueOf(raw), "operator is required");
    String s = raw.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    if (s.equals("<>") || s.equals("==")) return s.equals("<>") ? NE : EQ;
    for (Operator op : values()) {
      if (op.symbol.equals(s) || op.name().equals(s.replace(' ', '_'))) return op;
    }
    throw EngineException.malformedFilter(raw, "unknown operator");
  }
}

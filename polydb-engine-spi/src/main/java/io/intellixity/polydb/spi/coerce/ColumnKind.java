package io.intellixity.polydb.spi.coerce;

import java.util.Locale;
import java.util.regex.Pattern;

/** Coarse value families used to convert boundary strings into native values. */
public enum ColumnKind {
  INTEGER,
  DECIMAL,
  FLOAT,
  BOOLEAN,
  DATE,
  TIME,
  TIMESTAMP,
  UUID,
  JSON,
  BINARY,
  TEXT;

  private static final Pattern INTEGER_TYPE = Pattern.compile(
      "(tiny|small|medium|big)?int(eger)?\\d*( unsigned)?|u?int\\d+|(small|big)?serial\\d*|long|short|byte|unsigned_long");
  private static final Pattern FLOAT_TYPE = Pattern.compile(
      "real|float\\d*|double( precision)?|half_float|scaled_float");

  /**
   * Classifies a declared type name such as {@code varchar(255)}, {@code int8}, {@code timestamptz}
   * or {@code double precision}. Unknown names fall back to {@link #TEXT}.
   */
  public static ColumnKind classify(String typeName) {
    if (typeName == null || typeName.isBlank()) return TEXT;
    String t = typeName.trim().toLowerCase(Locale.ROOT);
    int paren = t.indexOf('(');
    if (paren > 0) t = t.substring(0, paren).trim();
    if (t.endsWith("[]")) return TEXT;

    if (t.startsWith("bool")) return BOOLEAN;
    if (t.equals("uuid") || t.equals("uniqueidentifier")) return UUID;
    if (t.equals("json") || t.equals("jsonb")) return JSON;
    if (t.startsWith("timestamp") || t.startsWith("datetime")) return TIMESTAMP;
    if (t.equals("date") || t.equals("date32")) return DATE;
    if (t.startsWith("time")) return TIME;
    if (INTEGER_TYPE.matcher(t).matches()) return INTEGER;
    if (t.equals("numeric") || t.equals("decimal") || t.equals("money") || t.startsWith("decimal")) return DECIMAL;
    if (FLOAT_TYPE.matcher(t).matches()) return FLOAT;
    if (t.equals("bytea") || t.endsWith("blob") || t.equals("binary") || t.equals("varbinary")) return BINARY;
    return TEXT;
  }

  public boolean isNumeric() {
    return this == INTEGER || this == DECIMAL || this == FLOAT;
  }
}

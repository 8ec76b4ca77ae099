package io.intellixity.polydb.spi.coerce;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.polydb.error.EngineException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;

/**
 * Converts boundary strings into typed values before they reach a driver.
 *
 * <p>A value that does not parse for its column kind is a {@code MALFORMED_FILTER} when it came from a
 * filter and a {@code MALFORMED_INPUT} when it came from a write.</p>
 */
public final class ValueCoercion {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final Set<String> TRUE = Set.of("true", "t", "1", "yes", "y", "on");
  private static final Set<String> FALSE = Set.of("false", "f", "0", "no", "n", "off");

  private ValueCoercion() {}

  public enum Mode { FILTER, WRITE }

  /**
   * @param kind target kind
   * @param raw boundary string, may be {@code null}
   * @param subject column name used in error messages
   * @return typed value, or {@code null} for {@code null} input and for empty non-text writes
   */
  public static Object coerce(ColumnKind kind, String raw, String subject, Mode mode) {
    if (raw == null) return null;
    if (kind == ColumnKind.TEXT) return raw;
    String s = raw.trim();
    if (s.isEmpty()) {
      if (mode == Mode.WRITE) return null;
      throw failure(mode, subject, "empty value for " + kind.name().toLowerCase(Locale.ROOT) + " column", null);
    }
    try {
      return switch (kind) {
        case INTEGER -> integer(s);
        case DECIMAL -> new BigDecimal(s);
        case FLOAT -> Double.parseDouble(s);
        case BOOLEAN -> bool(s);
        case DATE -> LocalDate.parse(s);
        case TIME -> LocalTime.parse(s);
        case TIMESTAMP -> timestamp(s);
        case UUID -> uuid(s);
        case JSON -> json(s);
        case BINARY -> binary(s);
        case TEXT -> raw;
      };
    } catch (NumberFormatException | DateTimeParseException e) {
      throw failure(mode, subject, "'" + raw + "' is not a valid " + kind.name().toLowerCase(Locale.ROOT), e);
    } catch (IllegalArgumentException e) {
      throw failure(mode, subject, e.getMessage(), e);
    }
  }

  public static Object coerce(String typeName, String raw, String subject, Mode mode) {
    return coerce(ColumnKind.classify(typeName), raw, subject, mode);
  }

  /**
   * Orders two values produced by {@link #coerce}. Numbers compare numerically across classes,
   * temporals chronologically, everything else by string form.
   */
  @SuppressWarnings("unchecked")
  public static int compare(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y) return toDecimal(x).compareTo(toDecimal(y));
    if (a instanceof LocalDateTime x && b instanceof LocalDateTime y) return x.compareTo(y);
    if (a instanceof OffsetDateTime x && b instanceof OffsetDateTime y) return x.compareTo(y);
    if (a instanceof OffsetDateTime x && b instanceof LocalDateTime y) return x.toLocalDateTime().compareTo(y);
    if (a instanceof LocalDateTime x && b instanceof OffsetDateTime y) return x.compareTo(y.toLocalDateTime());
    if (a instanceof Temporal && a instanceof Comparable<?> && a.getClass() == b.getClass()) {
      return ((Comparable<Object>) a).compareTo(b);
    }
    if (a instanceof Boolean x && b instanceof Boolean y) return x.compareTo(y);
    if (a instanceof java.util.UUID x && b instanceof java.util.UUID y) return x.compareTo(y);
    return String.valueOf(a).compareTo(String.valueOf(b));
  }

  private static BigDecimal toDecimal(Number n) {
    if (n instanceof BigDecimal d) return d;
    if (n instanceof BigInteger i) return new BigDecimal(i);
    if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
    return BigDecimal.valueOf(n.longValue());
  }

  private static Object integer(String s) {
    BigInteger v = new BigInteger(s);
    return v.bitLength() < 64 ? (Object) v.longValue() : v;
  }

  private static Boolean bool(String s) {
    String v = s.toLowerCase(Locale.ROOT);
    if (TRUE.contains(v)) return Boolean.TRUE;
    if (FALSE.contains(v)) return Boolean.FALSE;
    throw new IllegalArgumentException("'" + s + "' is not a valid boolean");
  }

  private static Temporal timestamp(String s) {
    if (s.length() == 10) return LocalDate.parse(s).atStartOfDay();
    String iso = s.length() > 10 && s.charAt(10) == ' ' ? s.substring(0, 10) + 'T' + s.substring(11) : s;
    try {
      return LocalDateTime.parse(iso);
    } catch (DateTimeParseException e) {
      return OffsetDateTime.parse(iso.endsWith("z") ? iso.substring(0, iso.length() - 1) + "Z" : iso);
    }
  }

  private static java.util.UUID uuid(String s) {
    java.util.UUID u = java.util.UUID.fromString(s);
    if (!u.toString().equalsIgnoreCase(s)) throw new IllegalArgumentException("'" + s + "' is not a valid uuid");
    return u;
  }

  private static String json(String s) {
    try {
      JSON.readTree(s);
      return s;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("'" + s + "' is not valid json: " + e.getOriginalMessage(), e);
    }
  }

  private static byte[] binary(String s) {
    String hex = s;
    if (hex.startsWith("0x") || hex.startsWith("0X") || hex.startsWith("\\x")) hex = hex.substring(2);
    try {
      return HexFormat.of().parseHex(hex);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("'" + s + "' is not a hex encoded binary value", e);
    }
  }

  private static EngineException failure(Mode mode, String subject, String detail, Throwable cause) {
    return mode == Mode.FILTER
        ? EngineException.malformedFilter(subject, detail, cause)
        : EngineException.malformedInput(subject, detail, cause);
  }
}

package io.intellixity.polydb.error;

import io.intellixity.polydb.model.DatabaseType;

import java.util.Objects;

/**
 * Single unchecked error type raised by every adapter operation.
 *
 * <p>Carries the {@link ErrorKind}, the engine type, the operation name and the offending subject
 * (storage unit, column, filter fragment or raw query) so callers can render an actionable message
 * without looking at adapter internals.</p>
 */
public class EngineException extends RuntimeException {
  private final ErrorKind kind;
  private final DatabaseType type;
  private final String operation;
  private final String subject;
  private final String detail;

  public EngineException(ErrorKind kind, DatabaseType type, String operation, String subject, String detail, Throwable cause) {
    super(format(kind, type, operation, subject, detail), cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.type = type;
    this.operation = operation;
    this.subject = subject;
    this.detail = detail;
  }

  public EngineException(ErrorKind kind, DatabaseType type, String operation, String subject, String detail) {
    this(kind, type, operation, subject, detail, null);
  }

  public ErrorKind kind() { return kind; }
  public DatabaseType type() { return type; }
  public String operation() { return operation; }
  public String subject() { return subject; }
  public String detail() { return detail; }

  /** Copy of this error with engine type and operation filled in where still unknown. */
  public EngineException withContext(DatabaseType type, String operation) {
    if (this.type != null && this.operation != null) return this;
    EngineException e = new EngineException(kind,
        this.type != null ? this.type : type,
        this.operation != null ? this.operation : operation,
        subject, detail, getCause());
    e.setStackTrace(getStackTrace());
    return e;
  }

  public static EngineException unavailable(DatabaseType type, String operation, Throwable cause) {
    return new EngineException(ErrorKind.UNAVAILABLE, type, operation, null,
        "cannot connect" + (cause == null || cause.getMessage() == null ? "" : " (" + cause.getMessage() + ")"), cause);
  }

  public static EngineException unsupported(DatabaseType type, String operation) {
    return new EngineException(ErrorKind.UNSUPPORTED_OPERATION, type, operation, null,
        "operation is not supported by this engine");
  }

  public static EngineException malformedFilter(String subject, String detail) {
    return new EngineException(ErrorKind.MALFORMED_FILTER, null, null, subject, detail);
  }

  public static EngineException malformedFilter(String subject, String detail, Throwable cause) {
    return new EngineException(ErrorKind.MALFORMED_FILTER, null, null, subject, detail, cause);
  }

  public static EngineException malformedInput(String subject, String detail) {
    return new EngineException(ErrorKind.MALFORMED_INPUT, null, null, subject, detail);
  }

  public static EngineException malformedInput(String subject, String detail, Throwable cause) {
    return new EngineException(ErrorKind.MALFORMED_INPUT, null, null, subject, detail, cause);
  }

  public static EngineException executionFailure(DatabaseType type, String operation, String subject, Throwable cause) {
    return new EngineException(ErrorKind.EXECUTION_FAILURE, type, operation, subject,
        cause == null ? "execution failed" : String.valueOf(cause.getMessage()), cause);
  }

  public static EngineException unsupportedType(String requested) {
    return new EngineException(ErrorKind.UNSUPPORTED_TYPE, null, "choose", requested, "unknown database type");
  }

  private static String format(ErrorKind kind, DatabaseType type, String operation, String subject, String detail) {
    StringBuilder sb = new StringBuilder();
    sb.append(kind);
    if (type != null) sb.append(" [").append(type.id()).append(']');
    if (operation != null) sb.append(' ').append(operation);
    if (subject != null) sb.append(" '").append(subject).append('\'');
    if (detail != null) sb.append(": ").append(detail);
    return sb.toString();
  }
}

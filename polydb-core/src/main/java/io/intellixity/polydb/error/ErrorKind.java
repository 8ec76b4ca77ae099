package io.intellixity.polydb.error;

public enum ErrorKind {
  /** Cannot connect to the engine. */
  UNAVAILABLE,
  /** The engine cannot meaningfully perform this call. */
  UNSUPPORTED_OPERATION,
  /** Filter references an invalid column, operator or value type. */
  MALFORMED_FILTER,
  /** Row or schema input cannot be coerced or validated. */
  MALFORMED_INPUT,
  /** Native driver rejected the operation. */
  EXECUTION_FAILURE,
  /** Caller requested an unregistered database type. */
  UNSUPPORTED_TYPE
}

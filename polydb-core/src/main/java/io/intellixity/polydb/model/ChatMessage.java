package io.intellixity.polydb.model;

import java.util.Objects;

/**
 * One reply of the chat passthrough. {@code type} is {@code message} for plain text or
 * {@code sql} when a generated statement was executed; {@code result} is set only for the latter.
 */
public record ChatMessage(String type, String text, RowsResult result) {
  public static final String MESSAGE = "message";
  public static final String SQL = "sql";

  public ChatMessage {
    Objects.requireNonNull(type, "type");
  }

  public static ChatMessage text(String text) {
    return new ChatMessage(MESSAGE, text, null);
  }
}

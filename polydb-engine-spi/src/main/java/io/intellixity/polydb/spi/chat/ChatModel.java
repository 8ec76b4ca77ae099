package io.intellixity.polydb.spi.chat;

import io.intellixity.polydb.model.DatabaseType;

/**
 * Natural-language collaborator used by {@code chat}.
 *
 * <p>Given the schema context and the running conversation, a model answers either with plain text
 * or with a query in the engine's native language that the adapter then executes.</p>
 */
@FunctionalInterface
public interface ChatModel {
  ChatReply complete(ChatRequest request) throws Exception;

  record ChatRequest(DatabaseType type, String schema, String schemaContext,
                     String previousConversation, String query) {}

  record ChatReply(Kind kind, String text) {
    public enum Kind { MESSAGE, QUERY }

    public static ChatReply message(String text) { return new ChatReply(Kind.MESSAGE, text); }
    public static ChatReply query(String text) { return new ChatReply(Kind.QUERY, text); }
  }
}

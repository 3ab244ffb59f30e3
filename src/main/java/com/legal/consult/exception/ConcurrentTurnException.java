package com.legal.consult.exception;

/**
 * Another turn on the same conversation committed first.
 */
public class ConcurrentTurnException extends PersistenceException {

    private final String conversationId;

    public ConcurrentTurnException(String conversationId, Throwable cause) {
        super("Conversation " + conversationId + " was modified by a concurrent turn", cause);
        this.conversationId = conversationId;
    }

    public String getConversationId() {
        return conversationId;
    }
}

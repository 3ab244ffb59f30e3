package com.legal.consult.exception;

public class ConversationNotFoundException extends NotFoundException {

    public ConversationNotFoundException(String conversationId) {
        super("Conversation not found: " + conversationId);
    }
}

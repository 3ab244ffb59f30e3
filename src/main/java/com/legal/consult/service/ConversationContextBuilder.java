package com.legal.consult.service;

import com.legal.consult.conversation.SenderType;
import com.legal.consult.dto.ChatMessage;
import com.legal.consult.dto.PromptTemplate;
import com.legal.consult.entity.ConversationMessage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the chat completion message list: system prompt, bounded history (oldest first), new user message.
 */
@Component
public class ConversationContextBuilder {

    public static final int HISTORY_WINDOW = 10;

    public List<ChatMessage> build(String userMessage, List<ConversationMessage> history, PromptTemplate template) {
        List<ConversationMessage> window = history == null ? List.of() : history;
        if (window.size() > HISTORY_WINDOW) {
            window = window.subList(window.size() - HISTORY_WINDOW, window.size());
        }

        List<ChatMessage> messages = new ArrayList<>(window.size() + 2);
        messages.add(new ChatMessage(ChatMessage.ROLE_SYSTEM, template.getContent()));
        for (ConversationMessage turn : window) {
            String role = turn.getSenderType() == SenderType.USER ? ChatMessage.ROLE_USER : ChatMessage.ROLE_ASSISTANT;
            messages.add(new ChatMessage(role, turn.getContent()));
        }
        messages.add(new ChatMessage(ChatMessage.ROLE_USER, userMessage));
        return messages;
    }
}

package com.legal.consult.service;

import com.legal.consult.conversation.AiProvider;
import com.legal.consult.dto.ChatMessage;
import com.legal.consult.dto.ModelConfig;
import com.legal.consult.dto.ProviderReply;

import java.util.List;

/**
 * One LLM backend. Implementations make exactly one synchronous call per {@link #send} and never retry.
 */
public interface LlmProviderAdapter {

    AiProvider provider();

    /** Generation parameters from configuration. */
    ModelConfig defaultModelConfig();

    /**
     * @throws com.legal.consult.exception.CredentialException no active key for this provider
     * @throws com.legal.consult.exception.ProviderException   transport failure, non-2xx or unreadable payload
     */
    ProviderReply send(List<ChatMessage> messages, ModelConfig modelConfig);
}

package com.legal.consult.dto;

import com.legal.consult.conversation.ConversationPhase;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assistant reply for one turn, ready to be persisted.
 */
public final class AiResponse {

    private final String content;
    private final ConversationPhase nextPhase;
    private final boolean transitioned;
    private final Map<String, Object> metadata;

    public AiResponse(String content, ConversationPhase nextPhase, boolean transitioned, Map<String, Object> metadata) {
        this.content = content;
        this.nextPhase = nextPhase;
        this.transitioned = transitioned;
        this.metadata = metadata == null ? Collections.emptyMap() : new LinkedHashMap<>(metadata);
    }

    public String getContent() {
        return content;
    }

    public ConversationPhase getNextPhase() {
        return nextPhase;
    }

    public boolean isTransitioned() {
        return transitioned;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }
}
